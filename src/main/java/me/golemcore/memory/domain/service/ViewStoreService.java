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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ConcurrentViewModificationException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Persistence of derived views with optimistic concurrency.
 *
 * <p>
 * Live views (any status) are kept per user in {@code views/<user>.json};
 * closed views past retention move to {@code views-archive/<user>.jsonl}.
 * Readers always get copies. Writers go through {@link #update}, which
 * commits only if the view's revision is still the one they read, or through
 * {@link #modify}, which re-reads and retries on a stale revision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViewStoreService {

    private static final String VIEWS_DIR = "views";
    private static final String ARCHIVE_DIR = "views-archive";
    private static final String JSON_EXTENSION = ".json";
    private static final int MAX_MODIFY_ATTEMPTS = 5;

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;

    private final Map<String, Map<String, DerivedView>> viewCache = new ConcurrentHashMap<>();

    public List<DerivedView> list(String userId) {
        Map<String, DerivedView> views = loadViews(userId);
        synchronized (views) {
            return views.values().stream().map(DerivedView::copy).toList();
        }
    }

    public List<DerivedView> listActive(String userId) {
        return list(userId).stream().filter(DerivedView::isActive).toList();
    }

    public List<DerivedView> listByPatternKey(String userId, String patternKey) {
        return list(userId).stream().filter(view -> patternKey.equals(view.getPatternKey())).toList();
    }

    public Optional<DerivedView> get(String userId, String viewId) {
        Map<String, DerivedView> views = loadViews(userId);
        synchronized (views) {
            DerivedView view = views.get(viewId);
            return Optional.ofNullable(view).map(DerivedView::copy);
        }
    }

    /**
     * Stores a new view at revision 1, assigning an id when it has none.
     */
    public DerivedView insert(DerivedView view) {
        if (view.getViewId() == null || view.getViewId().isBlank()) {
            view.setViewId(UUID.randomUUID().toString());
        }
        Map<String, DerivedView> views = loadViews(view.getUserId());
        synchronized (views) {
            if (views.containsKey(view.getViewId())) {
                throw new ValidationException("View " + view.getViewId() + " already exists");
            }
            DerivedView stored = view.copy();
            stored.setRevision(1);
            views.put(stored.getViewId(), stored);
            persist(view.getUserId(), views);
            log.debug("[ViewStore] Inserted view {} ({})", stored.getViewId(), stored.getHypothesis());
            return stored.copy();
        }
    }

    /**
     * Applies {@code mutation} to a copy of the view and commits it if the view
     * is still at {@code expectedRevision}.
     *
     * @throws ConcurrentViewModificationException
     *             if someone else changed the view in between
     */
    public DerivedView update(String userId, String viewId, long expectedRevision, Consumer<DerivedView> mutation) {
        Map<String, DerivedView> views = loadViews(userId);
        synchronized (views) {
            DerivedView current = views.get(viewId);
            if (current == null) {
                throw new ValidationException("Unknown view: " + viewId);
            }
            if (current.getRevision() != expectedRevision) {
                throw new ConcurrentViewModificationException(viewId, expectedRevision, current.getRevision());
            }
            DerivedView working = current.copy();
            mutation.accept(working);
            working.setRevision(current.getRevision() + 1);
            views.put(viewId, working);
            try {
                persist(userId, views);
            } catch (RuntimeException e) {
                views.put(viewId, current);
                throw e;
            }
            return working.copy();
        }
    }

    /**
     * Read-mutate-commit with retries on concurrent modification.
     */
    public DerivedView modify(String userId, String viewId, Consumer<DerivedView> mutation) {
        ConcurrentViewModificationException last = null;
        for (int attempt = 1; attempt <= MAX_MODIFY_ATTEMPTS; attempt++) {
            DerivedView current = get(userId, viewId)
                    .orElseThrow(() -> new ValidationException("Unknown view: " + viewId));
            try {
                return update(userId, viewId, current.getRevision(), mutation);
            } catch (ConcurrentViewModificationException e) {
                last = e;
                log.debug("[ViewStore] Retrying modification of {} (attempt {})", viewId, attempt);
            }
        }
        throw last;
    }

    /**
     * Moves closed views whose {@code closedAt} is before {@code cutoff} to the
     * archive file.
     *
     * @return number of views archived
     */
    public int archiveClosed(String userId, Instant cutoff) {
        Map<String, DerivedView> views = loadViews(userId);
        synchronized (views) {
            List<DerivedView> expired = views.values().stream()
                    .filter(view -> view.getStatus().isTerminal())
                    .filter(view -> view.getClosedAt() != null && view.getClosedAt().isBefore(cutoff))
                    .toList();
            if (expired.isEmpty()) {
                return 0;
            }
            StringBuilder payload = new StringBuilder();
            expired.forEach(view -> payload.append(jsonlCodec.toLine(view)));
            String path = userId + ".jsonl";
            storageRetry.write("archive views of " + userId,
                    () -> storagePort.appendText(ARCHIVE_DIR, path, payload.toString()));
            expired.forEach(view -> views.remove(view.getViewId()));
            persist(userId, views);
            log.info("[ViewStore] Archived {} closed view(s) of user {}", expired.size(), userId);
            return expired.size();
        }
    }

    public List<DerivedView> listArchived(String userId) {
        String content = storageRetry.read("read archived views of " + userId,
                () -> storagePort.getText(ARCHIVE_DIR, userId + ".jsonl"));
        return jsonlCodec.parseLines(content, DerivedView.class, ARCHIVE_DIR + "/" + userId);
    }

    public List<String> knownUsers() {
        return storageRetry.read("list view files", () -> storagePort.listObjects(VIEWS_DIR, "")).stream()
                .filter(file -> file.endsWith(JSON_EXTENSION) && !file.contains("/"))
                .map(file -> file.substring(0, file.length() - JSON_EXTENSION.length()))
                .toList();
    }

    private Map<String, DerivedView> loadViews(String userId) {
        return viewCache.computeIfAbsent(userId, id -> {
            Map<String, DerivedView> views = new LinkedHashMap<>();
            String json = storageRetry.read("read views of " + id,
                    () -> storagePort.getText(VIEWS_DIR, id + JSON_EXTENSION));
            if (json != null && !json.isBlank()) {
                List<DerivedView> stored = jsonlCodec.fromJson(json, new TypeReference<List<DerivedView>>() {
                });
                stored.forEach(view -> views.put(view.getViewId(), view));
            }
            return views;
        });
    }

    private void persist(String userId, Map<String, DerivedView> views) {
        String json = jsonlCodec.toJson(new ArrayList<>(views.values()));
        storageRetry.write("write views of " + userId,
                () -> storagePort.putTextAtomic(VIEWS_DIR, userId + JSON_EXTENSION, json, true));
    }
}
