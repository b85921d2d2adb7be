package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.RawInput;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of original inputs, kept per user and UTC month under
 * {@code raw/}. Updates (e.g. marking an input structured) append a newer
 * line with the same id; reads keep the last line per id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RawInputStore {

    private static final String RAW_DIR = "raw";

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;

    public void save(RawInput input) {
        String path = input.getUserId() + "/" + YearMonth.from(input.getReceivedAt().atZone(ZoneOffset.UTC))
                + ".jsonl";
        String line = jsonlCodec.toLine(input);
        storageRetry.write("append raw input to " + path, () -> storagePort.appendText(RAW_DIR, path, line));
        log.debug("[RawInput] Stored input {} ({})", input.getInputId(), input.getStatus());
    }

    public List<RawInput> list(String userId) {
        List<String> files = storageRetry.read("list raw inputs of " + userId,
                () -> storagePort.listObjects(RAW_DIR, userId));
        Map<String, RawInput> latest = new LinkedHashMap<>();
        for (String file : files) {
            String content = storageRetry.read("read " + file, () -> storagePort.getText(RAW_DIR, file));
            for (RawInput input : jsonlCodec.parseLines(content, RawInput.class, file)) {
                latest.put(input.getInputId(), input);
            }
        }
        return new ArrayList<>(latest.values());
    }
}
