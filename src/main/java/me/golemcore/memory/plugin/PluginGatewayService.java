package me.golemcore.memory.plugin;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.PermissionDeniedException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Entity;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.MemoryPermission;
import me.golemcore.memory.domain.model.MemoryStatistics;
import me.golemcore.memory.domain.model.StableConcept;
import me.golemcore.memory.domain.model.ViewProposal;
import me.golemcore.memory.domain.model.ViewType;
import me.golemcore.memory.domain.service.AuditService;
import me.golemcore.memory.domain.service.ConfidenceModel;
import me.golemcore.memory.domain.service.EntityResolverService;
import me.golemcore.memory.domain.service.EventStoreService;
import me.golemcore.memory.domain.service.EventValidator;
import me.golemcore.memory.domain.service.MemoryStatisticsService;
import me.golemcore.memory.domain.service.StableConceptRegistry;
import me.golemcore.memory.domain.service.ViewLifecycleService;
import me.golemcore.memory.domain.service.ViewStoreService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.inbound.MemoryConsumerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Guards the consumer boundary.
 *
 * <p>
 * Consumers come from {@code memory.consumers.<id>.*} or are registered at
 * runtime. Each call checks the consumer's permission before touching storage
 * and leaves an audit entry whether it succeeds or fails. Proposed views must
 * cite existing events; their confidence is clamped and discounted, so a
 * consumer can suggest but never assert.
 */
@Service
@Slf4j
public class PluginGatewayService implements MemoryConsumerPort {

    private static final String SOURCE_PREFIX = "plugin:";

    private final MemoryStatisticsService statisticsService;
    private final ViewStoreService viewStore;
    private final ViewLifecycleService viewLifecycle;
    private final StableConceptRegistry conceptRegistry;
    private final EntityResolverService entityResolver;
    private final EventStoreService eventStore;
    private final EventValidator eventValidator;
    private final AuditService auditService;
    private final MemoryProperties properties;
    private final Clock clock;

    private final Map<String, RegisteredConsumer> consumers = new ConcurrentHashMap<>();

    public PluginGatewayService(MemoryStatisticsService statisticsService, ViewStoreService viewStore,
            ViewLifecycleService viewLifecycle, StableConceptRegistry conceptRegistry,
            EntityResolverService entityResolver, EventStoreService eventStore, EventValidator eventValidator,
            AuditService auditService, MemoryProperties properties, Clock clock) {
        this.statisticsService = statisticsService;
        this.viewStore = viewStore;
        this.viewLifecycle = viewLifecycle;
        this.conceptRegistry = conceptRegistry;
        this.entityResolver = entityResolver;
        this.eventStore = eventStore;
        this.eventValidator = eventValidator;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
        properties.getConsumers().forEach((id, config) -> registerConsumer(id,
                config.getName() != null ? config.getName() : id, config.getPermission()));
    }

    /**
     * A consumer known to the gateway.
     */
    public record RegisteredConsumer(String consumerId, String name, MemoryPermission permission) {
    }

    public void registerConsumer(String consumerId, String name, MemoryPermission permission) {
        if (consumerId == null || consumerId.isBlank()) {
            throw new ValidationException("Consumer id must not be blank");
        }
        MemoryPermission granted = permission != null ? permission : MemoryPermission.READ_ONLY;
        consumers.put(consumerId, new RegisteredConsumer(consumerId, name, granted));
        log.info("[Gateway] Registered consumer '{}' ({}) with {}", consumerId, name, granted);
    }

    public Optional<RegisteredConsumer> getConsumer(String consumerId) {
        return Optional.ofNullable(consumerId).map(consumers::get);
    }

    @Override
    public MemoryStatistics getStatistics(String consumerId, String userId) {
        return guarded(consumerId, userId, "getStatistics", userId, MemoryPermission.READ_ONLY,
                () -> statisticsService.getStatistics(userId), statistics -> 1);
    }

    @Override
    public List<DerivedView> getActiveViews(String consumerId, String userId) {
        return guarded(consumerId, userId, "getActiveViews", userId, MemoryPermission.READ_ONLY,
                () -> viewStore.listActive(userId), List::size);
    }

    @Override
    public List<StableConcept> getActiveConcepts(String consumerId, String userId) {
        return guarded(consumerId, userId, "getActiveConcepts", userId, MemoryPermission.READ_ONLY,
                () -> conceptRegistry.getActiveConcepts(userId), List::size);
    }

    @Override
    public List<Entity> getEntities(String consumerId, String userId) {
        return guarded(consumerId, userId, "getEntities", userId, MemoryPermission.READ_ONLY,
                () -> entityResolver.getEntities(userId), List::size);
    }

    @Override
    public DerivedView proposeView(String consumerId, String userId, ViewProposal proposal) {
        String target = proposal == null ? userId : userId + ":" + proposal.hypothesis();
        return guarded(consumerId, userId, "proposeView", target, MemoryPermission.READ_WRITE_DERIVED,
                () -> createProposedView(consumerId, userId, proposal), view -> 1);
    }

    private DerivedView createProposedView(String consumerId, String userId, ViewProposal proposal) {
        if (proposal == null) {
            throw new ValidationException("Proposal must not be null");
        }
        if (proposal.derivedFrom().isEmpty()) {
            throw new ValidationException("A proposed view must cite at least one supporting event");
        }
        Set<String> cited = new LinkedHashSet<>(proposal.derivedFrom());
        Set<String> found = new LinkedHashSet<>();
        for (Event event : eventStore.findByIds(userId, cited)) {
            found.add(event.getEventId());
        }
        if (!found.containsAll(cited)) {
            Set<String> missing = new LinkedHashSet<>(cited);
            missing.removeAll(found);
            throw new ValidationException("Proposed view cites unknown events: " + missing);
        }

        Instant now = clock.instant();
        double confidence = ConfidenceModel.clamp(proposal.confidence())
                * properties.getViews().getProposedViewDiscount();
        DerivedView view = DerivedView.create(DerivedView.builder()
                .userId(userId)
                .hypothesis(proposal.hypothesis())
                .viewType(proposal.viewType() != null ? proposal.viewType() : ViewType.BELIEF)
                .subject(proposal.subject())
                .action(proposal.action())
                .category(proposal.category())
                .contextTag(proposal.contextTag())
                .derivedFrom(new ArrayList<>(cited))
                .priorConfidence(confidence)
                .confidence(confidence)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(Duration.ofDays(properties.getViews().getDefaultTtlDays())))
                .source(SOURCE_PREFIX + consumerId));
        DerivedView stored = viewLifecycle.propose(view);
        log.info("[Gateway] Consumer '{}' proposed view {} for user {}", consumerId, stored.getViewId(), userId);
        return stored;
    }

    private <T> T guarded(String consumerId, String userId, String operation, String target,
            MemoryPermission required, Supplier<T> action, ToIntFunction<T> resultSize) {
        RegisteredConsumer consumer = consumerId == null ? null : consumers.get(consumerId);
        if (consumer == null) {
            auditService.record(userId, consumerId, operation, target, false, 0, "unknown consumer");
            throw new PermissionDeniedException(consumerId, "Unknown consumer: " + consumerId);
        }
        if (!consumer.permission().allows(required)) {
            auditService.record(userId, consumerId, operation, target, false, 0,
                    "requires " + required + ", has " + consumer.permission());
            log.warn("[Gateway] Consumer '{}' denied {} (has {})", consumerId, operation, consumer.permission());
            throw new PermissionDeniedException(consumerId,
                    "Consumer " + consumerId + " lacks " + required + " for " + operation);
        }
        try {
            eventValidator.validateUserId(userId);
            T result = action.get();
            auditService.record(userId, consumerId, operation, target, true, resultSize.applyAsInt(result), null);
            return result;
        } catch (RuntimeException e) {
            auditService.record(userId, consumerId, operation, target, false, 0, e.getMessage());
            throw e;
        }
    }
}
