package io.huddle.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import io.huddle.config.GateFlag;
import io.huddle.config.HuddleConfig;
import io.huddle.identity.Identity;
import io.huddle.identity.IdentityStore;
import io.huddle.model.InstanceUpdate;
import io.huddle.model.InstanceView;
import io.huddle.model.MemoryEntry;
import io.huddle.model.MemoryPatch;
import io.huddle.model.MemoryScope;
import io.huddle.model.MessageType;
import io.huddle.model.MessageView;
import io.huddle.model.RoleView;
import io.huddle.model.SessionAction;
import io.huddle.model.SessionLogEntry;
import io.huddle.model.TaskStatus;
import io.huddle.model.TaskView;
import io.huddle.observability.AuditLogger;
import io.huddle.storage.Database;
import io.huddle.storage.InstanceStore;
import io.huddle.storage.MemoryStore;
import io.huddle.storage.MessageStore;
import io.huddle.storage.RoleStore;
import io.huddle.storage.SessionLogStore;
import io.huddle.storage.StorageException;
import io.huddle.storage.TaskStore;
import io.huddle.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class HuddleRuntime {
    private static final String DEFAULT_ROLES_RESOURCE = "default-roles.json";
    private static final String DEFAULT_MODEL = "opus";

    private final HuddleConfig config;
    private final Clock clock;
    private final Database database;
    private final IdentityStore identityStore;
    private final InstanceStore instanceStore;
    private final MessageStore messageStore;
    private final MemoryStore memoryStore;
    private final SessionLogStore sessionLogStore;
    private final TaskStore taskStore;
    private final RoleStore roleStore;
    private final AuditLogger auditLogger;

    public HuddleRuntime(HuddleConfig config) {
        this(config, Clock.systemUTC());
    }

    public HuddleRuntime(HuddleConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
        this.identityStore = new IdentityStore(config.identityFile());
        this.instanceStore = new InstanceStore(database);
        this.messageStore = new MessageStore(database);
        this.memoryStore = new MemoryStore(database);
        this.sessionLogStore = new SessionLogStore(database);
        this.taskStore = new TaskStore(database);
        this.roleStore = new RoleStore(database);
        this.auditLogger = new AuditLogger(config.auditFile());
    }

    public void init() {
        database.init();
    }

    public InitOutcome initSchema() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of("schema.init", currentActor(), "db/" + config.dbFile(), "ok", Map.of()));
        return new InitOutcome(config.dbFile().toString(), database.appliedMigrations(), config.enabled());
    }

    public Optional<Identity> identity() {
        return identityStore.load();
    }

    // ---------------------------------------------------------------- presence

    public RegisterOutcome register(String project, String workingDir, String model) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project must not be blank");
        }
        String instanceId = UUID.randomUUID().toString().substring(0, 12);
        String dir = workingDir == null || workingDir.isBlank() ? System.getProperty("user.dir") : workingDir;
        String resolvedModel = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        long now = now();

        instanceStore.upsert(instanceId, project, dir, resolvedModel, now);
        identityStore.save(instanceId, project);
        sessionLogStore.append(instanceId, project, SessionAction.STARTED, "Session started in " + dir, List.of(), now);

        List<InstanceView> others = instanceStore.listActive(now - HuddleConfig.ACTIVE_WINDOW_MS, now).stream()
                .filter(i -> !i.instanceId().equals(instanceId))
                .toList();
        int unread = messageStore.countUnread(instanceId, project, now);

        auditLogger.log(AuditLogger.AuditEvent.of("instance.register", instanceId, "instance/" + instanceId, "ok",
                Map.of("project", project, "model", resolvedModel)));
        return new RegisterOutcome(instanceId, project, dir, resolvedModel, others, unread);
    }

    public HeartbeatOutcome heartbeat(InstanceUpdate change) {
        Identity me = requireIdentity();
        long now = now();
        if (!instanceStore.heartbeat(me.instanceId(), change, now)) {
            throw new NotFoundException("Instance", me.instanceId());
        }
        InstanceView view = instanceStore.find(me.instanceId(), now)
                .orElseThrow(() -> new NotFoundException("Instance", me.instanceId()));
        return new HeartbeatOutcome(view.instanceId(), view.status(), view.currentTask(), view.lastHeartbeatMs());
    }

    public StatusOutcome status() {
        long now = now();
        List<InstanceView> active = instanceStore.listActive(now - HuddleConfig.ACTIVE_WINDOW_MS, now);
        List<MessageView> messages = messageStore.recent(now - HuddleConfig.STATUS_MESSAGE_WINDOW_MS, HuddleConfig.STATUS_MESSAGE_LIMIT);
        List<SessionLogEntry> activity = sessionLogStore.recent(now - HuddleConfig.STATUS_ACTIVITY_WINDOW_MS, HuddleConfig.STATUS_ACTIVITY_LIMIT);
        return new StatusOutcome(active, messages, activity);
    }

    /**
     * Logs the shutdown, removes the presence row and forgets the local identity. Without an identity this
     * is a no-op that reports {@code registered=false}.
     */
    public DeregisterOutcome deregister() {
        Optional<Identity> me = identityStore.load();
        if (me.isEmpty()) {
            return new DeregisterOutcome(false, null);
        }
        Identity id = me.get();
        long now = now();
        sessionLogStore.append(id.instanceId(), id.project(), SessionAction.SHUTDOWN, "Session ended", List.of(), now);
        instanceStore.delete(id.instanceId());
        identityStore.clear();
        auditLogger.log(AuditLogger.AuditEvent.of("instance.deregister", id.instanceId(), "instance/" + id.instanceId(), "ok", Map.of()));
        return new DeregisterOutcome(true, id.instanceId());
    }

    // ---------------------------------------------------------------- messaging

    public SendOutcome send(String to, MessageType type, String subject, String body) {
        Identity me = requireIdentity();
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        MessageType resolved = type == null ? MessageType.INFO : type;
        long now = now();
        long id = messageStore.insert(new MessageStore.NewMessage(
                me.instanceId(), me.project(), to.trim(), resolved, subject, body, now, now + HuddleConfig.MESSAGE_TTL_MS));
        auditLogger.log(AuditLogger.AuditEvent.of("message.send", me.instanceId(), "message/" + id, "ok",
                Map.of("to", to.trim(), "type", resolved.wireValue(), "subject", subject)));
        return new SendOutcome(id, resolved.wireValue(), to.trim(), subject);
    }

    public InboxOutcome inbox(boolean includeRead) {
        Identity me = requireIdentity();
        List<MessageView> messages = messageStore.inbox(me.instanceId(), me.project(), includeRead, now(), HuddleConfig.INBOX_PAGE_SIZE);
        return new InboxOutcome(me.instanceId(), me.project(), messages.size(), messages);
    }

    public MessageView read(long messageId) {
        MessageView m = messageStore.markRead(messageId)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        auditLogger.log(AuditLogger.AuditEvent.of("message.read", currentActor(), "message/" + messageId, "ok", Map.of()));
        return m;
    }

    // ---------------------------------------------------------------- memory and session log

    public RememberOutcome remember(MemoryScope scope, String project, String type, String title, String content,
                                    List<String> tags, List<String> relatedFiles) {
        if (scope == MemoryScope.PROJECT && (project == null || project.isBlank())) {
            throw new IllegalArgumentException("--project is required unless --global is set");
        }
        if (title == null || title.isBlank() || content == null || content.isBlank()) {
            throw new IllegalArgumentException("title and content must not be blank");
        }
        String resolvedType = scope.requireType(type);
        String createdBy = currentActor();
        long id = memoryStore.insert(new MemoryStore.NewMemory(
                scope,
                scope == MemoryScope.PROJECT ? project : null,
                resolvedType,
                title,
                content,
                tags == null ? List.of() : tags,
                scope == MemoryScope.PROJECT && relatedFiles != null ? relatedFiles : List.of(),
                createdBy,
                now()));
        auditLogger.log(AuditLogger.AuditEvent.of("memory.remember", createdBy, scope.table() + "/" + id, "ok",
                Map.of("type", resolvedType, "title", title)));
        return new RememberOutcome(id, scope.name().toLowerCase(Locale.ROOT), scope == MemoryScope.PROJECT ? project : null, resolvedType, title);
    }

    public RecallOutcome recall(MemoryScope scope, String project, String type, String search, int limit) {
        if (scope == MemoryScope.PROJECT && (project == null || project.isBlank())) {
            throw new IllegalArgumentException("--project is required unless --global is set");
        }
        String resolvedType = type == null || type.isBlank() ? null : scope.requireType(type);
        int resolvedLimit = limit <= 0 ? HuddleConfig.DEFAULT_RECALL_LIMIT : limit;
        List<MemoryEntry> rows = memoryStore.recall(new MemoryStore.RecallQuery(scope, project, resolvedType, search, resolvedLimit));
        return new RecallOutcome(scope.name().toLowerCase(Locale.ROOT), project, rows.size(), rows);
    }

    public MemoryEntry updateMemory(MemoryScope scope, long id, MemoryPatch patch) {
        MemoryPatch p = patch == null ? new MemoryPatch(null, null, null) : patch;
        if (!memoryStore.update(scope, id, p, now())) {
            throw new NotFoundException("Memory", id);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("memory.update", currentActor(), scope.table() + "/" + id, "ok",
                fields(p)));
        return memoryStore.find(scope, id).orElseThrow(() -> new NotFoundException("Memory", id));
    }

    public LogOutcome log(SessionAction action, String summary, List<String> files) {
        Identity me = requireIdentity();
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary must not be blank");
        }
        long id = sessionLogStore.append(me.instanceId(), me.project(), action, summary, files == null ? List.of() : files, now());
        return new LogOutcome(id, action.wireValue(), summary);
    }

    // ---------------------------------------------------------------- tasks

    public TaskView createTask(String title, String project, String description, String role, int priority,
                               List<String> fileScope, List<String> dependsOn) {
        if (title == null || title.isBlank() || project == null || project.isBlank()) {
            throw new IllegalArgumentException("title and project must not be blank");
        }
        String createdBy = currentActor();
        long id = taskStore.create(new TaskStore.NewTask(
                title,
                description,
                project,
                priority,
                role == null || role.isBlank() ? null : role.trim(),
                fileScope == null ? List.of() : fileScope,
                dependsOn == null ? List.of() : dependsOn,
                createdBy,
                now()));
        auditLogger.log(AuditLogger.AuditEvent.of("task.create", createdBy, "task/" + id, "ok",
                Map.of("project", project, "priority", priority, "title", title)));
        return taskStore.find(id).orElseThrow(() -> new NotFoundException("Task", id));
    }

    public List<TaskView> listTasks(String project, TaskStatus status, String role, boolean availableOnly) {
        return taskStore.list(new TaskStore.TaskQuery(project, status, role, availableOnly));
    }

    /**
     * Claims a pending task for the calling instance. The presence update that follows is a separate
     * statement; only the claimant performs it, so no other writer can interleave on that row.
     */
    public ClaimOutcome claimTask(long taskId) {
        Identity me = requireIdentity();
        long now = now();
        Optional<TaskView> claimed = taskStore.claim(taskId, me.instanceId(), now);
        if (claimed.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of("task.claim", me.instanceId(), "task/" + taskId, "not_available", Map.of()));
            throw new TaskNotAvailableException(taskId);
        }
        TaskView task = claimed.get();
        String rolePrompt = null;
        if (task.assignedRole() != null) {
            rolePrompt = roleStore.find(task.assignedRole()).map(RoleView::systemPrompt).orElse(null);
        }
        instanceStore.markBusy(me.instanceId(), task.title(), now);
        auditLogger.log(AuditLogger.AuditEvent.of("task.claim", me.instanceId(), "task/" + taskId, "ok",
                Map.of("title", task.title())));
        return new ClaimOutcome(task.id(), task.title(), task.description(), task.fileScope(), task.assignedRole(),
                rolePrompt, task.assignedInstance(), task.status());
    }

    public CompletionOutcome completeTask(long taskId, String result) {
        Optional<Identity> me = identityStore.load();
        long now = now();
        TaskStore.Completion completion = taskStore.complete(taskId, me.map(Identity::instanceId).orElse(null), result, now)
                .orElseThrow(() -> new NotFoundException("Task", taskId));
        me.ifPresent(id -> instanceStore.markActive(id.instanceId(), now));
        auditLogger.log(AuditLogger.AuditEvent.of("task.done", currentActor(), "task/" + taskId,
                completion.administrativeOverride() ? "override" : "ok", Map.of()));
        return new CompletionOutcome(completion.task(), completion.administrativeOverride());
    }

    public TaskView failTask(long taskId, String reason) {
        Optional<Identity> me = identityStore.load();
        long now = now();
        if (!taskStore.fail(taskId, reason, now)) {
            throw new NotFoundException("Task", taskId);
        }
        me.ifPresent(id -> instanceStore.markActive(id.instanceId(), now));
        auditLogger.log(AuditLogger.AuditEvent.of("task.fail", currentActor(), "task/" + taskId, "ok",
                Map.of("reason", reason == null ? "" : reason)));
        return taskStore.find(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    // ---------------------------------------------------------------- roles

    public List<RoleView> listRoles() {
        return roleStore.list();
    }

    public RoleView getRole(String name) {
        return roleStore.find(name).orElseThrow(() -> new NotFoundException("Role", name));
    }

    public RoleView saveRole(String name, String description, String systemPrompt, List<String> capabilities) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name must not be blank");
        }
        roleStore.upsert(new RoleStore.RoleDefinition(name.trim(), description, systemPrompt,
                capabilities == null ? List.of() : capabilities), now());
        auditLogger.log(AuditLogger.AuditEvent.of("role.save", currentActor(), "role/" + name.trim(), "ok", Map.of()));
        return getRole(name.trim());
    }

    public SeedOutcome seedRoles() {
        List<RoleStore.RoleDefinition> roles = loadDefaultRoles();
        int count = roleStore.upsertAll(roles, now());
        auditLogger.log(AuditLogger.AuditEvent.of("role.seed", currentActor(), "role/*", "ok", Map.of("count", count)));
        return new SeedOutcome(count, roles.stream().map(RoleStore.RoleDefinition::name).toList());
    }

    static List<RoleStore.RoleDefinition> loadDefaultRoles() {
        try (InputStream in = HuddleRuntime.class.getResourceAsStream(DEFAULT_ROLES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + DEFAULT_ROLES_RESOURCE);
            }
            return Jsons.mapper().readValue(in, new TypeReference<List<RoleStore.RoleDefinition>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load built-in roles", e);
        }
    }

    // ---------------------------------------------------------------- maintenance and gate

    public CleanupOutcome cleanup() {
        long now = now();
        int instances = instanceStore.deleteStale(now - HuddleConfig.STALE_AFTER_MS);
        int messages = messageStore.deleteExpired(now);
        int logs = sessionLogStore.purgeOlderThan(now - HuddleConfig.SESSION_LOG_RETENTION_MS);
        auditLogger.log(AuditLogger.AuditEvent.of("maintenance.cleanup", currentActor(), "db/" + config.dbFile(), "ok",
                Map.of("instances", instances, "messages", messages, "session_logs", logs)));
        return new CleanupOutcome(instances, messages, logs);
    }

    public GateOutcome enable() {
        GateFlag.write(config.flagFile(), true);
        auditLogger.log(AuditLogger.AuditEvent.of("gate.enable", currentActor(), "gate", "ok", Map.of()));
        return new GateOutcome(true, config.flagFile().toString(), null, null);
    }

    /**
     * Turns the gate off and drops this session's registration. A database failure while removing the
     * presence row is returned as a warning; the gate is off and the identity cleared regardless.
     */
    public GateOutcome disable() {
        GateFlag.write(config.flagFile(), false);
        Optional<Identity> me = identityStore.load();
        String removed = null;
        String warning = null;
        if (me.isPresent()) {
            try {
                instanceStore.delete(me.get().instanceId());
                removed = me.get().instanceId();
            } catch (StorageException e) {
                warning = "Could not remove instance " + me.get().instanceId() + ": " + rootMessage(e);
            }
            identityStore.clear();
        }
        auditLogger.log(AuditLogger.AuditEvent.of("gate.disable", me.map(Identity::instanceId).orElse(null), "gate",
                warning == null ? "ok" : "partial", Map.of()));
        return new GateOutcome(false, config.flagFile().toString(), removed, warning);
    }

    // ---------------------------------------------------------------- helpers

    private Identity requireIdentity() {
        return identityStore.load().orElseThrow(NotRegisteredException::new);
    }

    private String currentActor() {
        return identityStore.load().map(Identity::instanceId).orElse("human");
    }

    private long now() {
        return clock.millis();
    }

    private static Map<String, Object> fields(MemoryPatch p) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (p.title() != null) {
            out.put("title", p.title());
        }
        if (p.content() != null) {
            out.put("content_length", p.content().length());
        }
        if (p.status() != null) {
            out.put("status", p.status().wireValue());
        }
        return out;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    public record InitOutcome(String dbFile, List<String> migrations, boolean enabled) {
    }

    public record RegisterOutcome(String instanceId, String project, String workingDir, String model,
                                  List<InstanceView> activeInstances, int unreadMessages) {
    }

    public record HeartbeatOutcome(String instanceId, String status, String currentTask, long lastHeartbeatMs) {
    }

    public record StatusOutcome(List<InstanceView> activeInstances, List<MessageView> recentMessages,
                                List<SessionLogEntry> recentActivity) {
    }

    public record DeregisterOutcome(boolean registered, String instanceId) {
    }

    public record SendOutcome(long messageId, String type, String to, String subject) {
    }

    public record InboxOutcome(String instanceId, String project, int count, List<MessageView> messages) {
    }

    public record RememberOutcome(long id, String scope, String project, String type, String title) {
    }

    public record RecallOutcome(String scope, String project, int count, List<MemoryEntry> entries) {
    }

    public record LogOutcome(long id, String action, String summary) {
    }

    public record ClaimOutcome(long taskId, String title, String description, List<String> fileScope, String role,
                               String rolePrompt, String assignedInstance, String status) {
    }

    public record CompletionOutcome(TaskView task, boolean administrativeOverride) {
    }

    public record SeedOutcome(int seeded, List<String> roles) {
    }

    public record CleanupOutcome(int instancesRemoved, int messagesRemoved, int sessionLogsRemoved) {
    }

    public record GateOutcome(boolean enabled, String flagFile, String instanceRemoved, String warning) {
    }
}
