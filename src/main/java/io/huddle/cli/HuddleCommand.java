package io.huddle.cli;

import io.huddle.config.HuddleConfig;
import io.huddle.identity.IdentityStore;
import io.huddle.model.InstanceStatus;
import io.huddle.model.InstanceUpdate;
import io.huddle.model.MemoryPatch;
import io.huddle.model.MemoryScope;
import io.huddle.model.MemoryStatus;
import io.huddle.model.MessageType;
import io.huddle.model.SessionAction;
import io.huddle.model.TaskStatus;
import io.huddle.runtime.HuddleRuntime;
import io.huddle.runtime.NotRegisteredException;
import io.huddle.storage.StorageException;
import io.huddle.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "huddle",
        mixinStandardHelpOptions = true,
        description = "Coordinate independent agent sessions through a shared SQLite database",
        subcommands = {
                HuddleCommand.InitCommand.class,
                HuddleCommand.EnableCommand.class,
                HuddleCommand.DisableCommand.class,
                HuddleCommand.RegisterCommand.class,
                HuddleCommand.HeartbeatCommand.class,
                HuddleCommand.StatusCommand.class,
                HuddleCommand.SendCommand.class,
                HuddleCommand.InboxCommand.class,
                HuddleCommand.ReadCommand.class,
                HuddleCommand.RememberCommand.class,
                HuddleCommand.RecallCommand.class,
                HuddleCommand.UpdateMemoryCommand.class,
                HuddleCommand.LogCommand.class,
                HuddleCommand.DeregisterCommand.class,
                HuddleCommand.CleanupCommand.class,
                HuddleCommand.TaskCreateCommand.class,
                HuddleCommand.TaskListCommand.class,
                HuddleCommand.TaskClaimCommand.class,
                HuddleCommand.TaskDoneCommand.class,
                HuddleCommand.TaskFailCommand.class,
                HuddleCommand.RoleListCommand.class,
                HuddleCommand.RoleGetCommand.class,
                HuddleCommand.RoleCreateCommand.class,
                HuddleCommand.RoleSeedCommand.class
        }
)
public final class HuddleCommand implements Runnable {
    private final Map<String, String> environment;
    private HuddleConfig config;

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data directory (default: $HUDDLE_HOME or ~/.huddle)")
    String root;

    @Option(names = {"--db"}, description = "SQLite database file (default: $HUDDLE_DB_FILE or <root>/huddle.db)")
    String db;

    @Option(names = {"--identity-file"}, description = "Instance identity file (default: $HUDDLE_INSTANCE_FILE or <root>/instance.json)")
    String identityFile;

    public HuddleCommand() {
        this(System.getenv());
    }

    HuddleCommand(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Builds the command line with the error reporting used by every subcommand.
     */
    public static CommandLine newCommandLine(HuddleCommand command) {
        return new CommandLine(command).setExecutionExceptionHandler(HuddleCommand::handleExecutionException);
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | enable | disable | register | heartbeat | status | send | inbox | read | remember | recall | update-memory | log | deregister | cleanup | task-create | task-list | task-claim | task-done | task-fail | role-list | role-get | role-create | role-seed");
        out().flush();
    }

    HuddleConfig config() {
        if (config == null) {
            config = HuddleConfig.fromEnvironment(environment, root, db, identityFile);
        }
        return config;
    }

    HuddleRuntime runtime() {
        return new HuddleRuntime(config());
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    void printJson(Object value) {
        out().println(Jsons.toJson(value));
        out().flush();
    }

    static int handleExecutionException(Exception ex, CommandLine cmd, CommandLine.ParseResult parseResult) {
        PrintWriter err = cmd.getErr();
        if (ex instanceof StorageException) {
            err.println("DB ERROR: " + rootMessage(ex));
            Object root = cmd.getCommandSpec().root().userObject();
            if (root instanceof HuddleCommand huddle) {
                err.println("Check that the database file is reachable and writable: " + huddle.config().dbFile());
            }
        } else {
            err.println("ERROR: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
        }
        err.flush();
        return 1;
    }

    private static String rootMessage(Throwable e) {
        StringBuilder sb = new StringBuilder(String.valueOf(e.getMessage()));
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }

    /**
     * Base for commands that only run while the gate is open. When it is closed they exit 0 without
     * output and without touching the database.
     */
    abstract static class GatedCommand implements Callable<Integer> {
        @ParentCommand
        HuddleCommand parent;

        @Override
        public final Integer call() {
            if (!parent.config().enabled()) {
                return 0;
            }
            if (actsAsInstance() && new IdentityStore(parent.config().identityFile()).load().isEmpty()) {
                throw new NotRegisteredException();
            }
            HuddleRuntime runtime = parent.runtime();
            runtime.init();
            return execute(runtime);
        }

        /** Commands that act as the registered instance fail before the database is opened. */
        boolean actsAsInstance() {
            return false;
        }

        abstract int execute(HuddleRuntime runtime);
    }

    @Command(name = "init", description = "Create the data directory and the database schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        HuddleCommand parent;

        @Override
        public Integer call() {
            parent.printJson(parent.runtime().initSchema());
            return 0;
        }
    }

    @Command(name = "enable", aliases = {"on"}, description = "Enable huddle (persists through the flag file)")
    static final class EnableCommand implements Callable<Integer> {
        @ParentCommand
        HuddleCommand parent;

        @Override
        public Integer call() {
            parent.printJson(parent.runtime().enable());
            return 0;
        }
    }

    @Command(name = "disable", aliases = {"off"}, description = "Disable huddle; every gated command becomes a silent no-op")
    static final class DisableCommand implements Callable<Integer> {
        @ParentCommand
        HuddleCommand parent;

        @Override
        public Integer call() {
            HuddleRuntime.GateOutcome outcome = parent.runtime().disable();
            if (outcome.warning() != null) {
                parent.err().println("WARNING: " + outcome.warning());
                parent.err().flush();
            }
            parent.printJson(outcome);
            return 0;
        }
    }

    @Command(name = "register", description = "Register this session as an instance")
    static final class RegisterCommand extends GatedCommand {
        @Option(names = {"--project"}, required = true, description = "Project name")
        String project;

        @Option(names = {"--dir"}, description = "Working directory (default: current directory)")
        String dir;

        @Option(names = {"--model"}, defaultValue = "opus", description = "Model name")
        String model;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.register(project, dir, model));
            return 0;
        }
    }

    @Command(name = "heartbeat", description = "Refresh this instance's heartbeat")
    static final class HeartbeatCommand extends GatedCommand {
        @Option(names = {"--task"}, description = "Current task label")
        String task;

        @Option(names = {"--status"}, description = "active|idle|busy|shutting_down")
        String status;

        @Override
        boolean actsAsInstance() {
            return true;
        }

        @Override
        int execute(HuddleRuntime runtime) {
            InstanceStatus parsed = status == null ? null : InstanceStatus.fromString(status);
            parent.printJson(runtime.heartbeat(new InstanceUpdate(task, parsed)));
            return 0;
        }
    }

    @Command(name = "status", description = "Show active instances, recent messages and recent activity")
    static final class StatusCommand extends GatedCommand {
        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.status());
            return 0;
        }
    }

    @Command(name = "send", description = "Send a message to an instance, a project or @all")
    static final class SendCommand extends GatedCommand {
        @Option(names = {"--to"}, required = true, description = "Instance id, project name or @all")
        String to;

        @Option(names = {"--subject"}, required = true, description = "Subject line")
        String subject;

        @Option(names = {"--body"}, description = "Message body")
        String body;

        @Option(names = {"--type"}, defaultValue = "info", description = "info|warning|blocker|request|done")
        String type;

        @Override
        boolean actsAsInstance() {
            return true;
        }

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.send(to, MessageType.fromString(type), subject, body));
            return 0;
        }
    }

    @Command(name = "inbox", description = "List messages addressed to this instance")
    static final class InboxCommand extends GatedCommand {
        @Option(names = {"--all"}, description = "Include read messages")
        boolean all;

        @Override
        boolean actsAsInstance() {
            return true;
        }

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.inbox(all));
            return 0;
        }
    }

    @Command(name = "read", description = "Show a message and mark it read")
    static final class ReadCommand extends GatedCommand {
        @Parameters(index = "0", description = "Message id")
        long messageId;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.read(messageId));
            return 0;
        }
    }

    @Command(name = "remember", description = "Store a memory entry")
    static final class RememberCommand extends GatedCommand {
        @Option(names = {"--project"}, description = "Project (required unless --global)")
        String project;

        @Option(names = {"--global"}, description = "Store in global memory")
        boolean global;

        @Option(names = {"--type"}, required = true, description = "Entry type")
        String type;

        @Option(names = {"--title"}, required = true, description = "Title")
        String title;

        @Option(names = {"--content"}, required = true, description = "Content")
        String content;

        @Option(names = {"--tags"}, description = "Comma-separated tags")
        String tags;

        @Option(names = {"--files"}, description = "Comma-separated related files")
        String files;

        @Override
        int execute(HuddleRuntime runtime) {
            MemoryScope scope = global ? MemoryScope.GLOBAL : MemoryScope.PROJECT;
            parent.printJson(runtime.remember(scope, project, type, title, content,
                    Jsons.splitCsv(tags), Jsons.splitCsv(files)));
            return 0;
        }
    }

    @Command(name = "recall", description = "Query memory entries")
    static final class RecallCommand extends GatedCommand {
        @Option(names = {"--project"}, description = "Project (required unless --global)")
        String project;

        @Option(names = {"--global"}, description = "Query global memory")
        boolean global;

        @Option(names = {"--type"}, description = "Filter by entry type")
        String type;

        @Option(names = {"--search"}, description = "Case-insensitive substring of title or content")
        String search;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        int execute(HuddleRuntime runtime) {
            MemoryScope scope = global ? MemoryScope.GLOBAL : MemoryScope.PROJECT;
            parent.printJson(runtime.recall(scope, project, type, search, limit));
            return 0;
        }
    }

    @Command(name = "update-memory", description = "Update fields of a memory entry")
    static final class UpdateMemoryCommand extends GatedCommand {
        @Parameters(index = "0", description = "Memory id")
        long memoryId;

        @Option(names = {"--global"}, description = "Entry lives in global memory")
        boolean global;

        @Option(names = {"--title"}, description = "New title")
        String title;

        @Option(names = {"--content"}, description = "New content")
        String content;

        @Option(names = {"--status"}, description = "active|resolved|deprecated|superseded")
        String status;

        @Override
        int execute(HuddleRuntime runtime) {
            MemoryScope scope = global ? MemoryScope.GLOBAL : MemoryScope.PROJECT;
            MemoryStatus parsed = status == null ? null : MemoryStatus.fromString(status);
            parent.printJson(runtime.updateMemory(scope, memoryId, new MemoryPatch(title, content, parsed)));
            return 0;
        }
    }

    @Command(name = "log", description = "Record a session action")
    static final class LogCommand extends GatedCommand {
        @Option(names = {"--action"}, required = true,
                description = "started|task_started|task_completed|issue_found|issue_resolved|docker_operation|file_modified|shutdown")
        String action;

        @Option(names = {"--summary"}, required = true, description = "What happened")
        String summary;

        @Option(names = {"--files"}, description = "Comma-separated modified files")
        String files;

        @Override
        boolean actsAsInstance() {
            return true;
        }

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.log(SessionAction.fromString(action), summary, Jsons.splitCsv(files)));
            return 0;
        }
    }

    @Command(name = "deregister", description = "Remove this instance and forget its identity")
    static final class DeregisterCommand extends GatedCommand {
        @Override
        int execute(HuddleRuntime runtime) {
            HuddleRuntime.DeregisterOutcome outcome = runtime.deregister();
            if (!outcome.registered()) {
                parent.out().println("Not registered.");
                parent.out().flush();
                return 0;
            }
            parent.printJson(outcome);
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Remove stale instances, expired messages and old session logs")
    static final class CleanupCommand extends GatedCommand {
        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.cleanup());
            return 0;
        }
    }

    @Command(name = "task-create", description = "Create a pending task")
    static final class TaskCreateCommand extends GatedCommand {
        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--project"}, required = true, description = "Project name")
        String project;

        @Option(names = {"--description"}, description = "Task description or spec")
        String description;

        @Option(names = {"--role"}, description = "Assigned role (planner, coder, qa, reviewer)")
        String role;

        @Option(names = {"--priority"}, defaultValue = "0", description = "Higher runs first")
        int priority;

        @Option(names = {"--file-scope"}, description = "Comma-separated files this task owns")
        String fileScope;

        @Option(names = {"--depends-on"}, description = "Comma-separated task ids")
        String dependsOn;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.createTask(title, project, description, role, priority,
                    Jsons.splitCsv(fileScope), Jsons.splitCsv(dependsOn)));
            return 0;
        }
    }

    @Command(name = "task-list", description = "List tasks by priority, then creation time")
    static final class TaskListCommand extends GatedCommand {
        @Option(names = {"--project"}, description = "Filter by project")
        String project;

        @Option(names = {"--status"}, description = "pending|claimed|in_progress|done|failed")
        String status;

        @Option(names = {"--role"}, description = "Filter by assigned role")
        String role;

        @Option(names = {"--available"}, description = "Only claimable (pending) tasks")
        boolean available;

        @Override
        int execute(HuddleRuntime runtime) {
            TaskStatus parsed = status == null ? null : TaskStatus.fromString(status);
            parent.printJson(runtime.listTasks(project, parsed, role, available));
            return 0;
        }
    }

    @Command(name = "task-claim", description = "Atomically claim a pending task")
    static final class TaskClaimCommand extends GatedCommand {
        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        boolean actsAsInstance() {
            return true;
        }

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.claimTask(taskId));
            return 0;
        }
    }

    @Command(name = "task-done", description = "Mark a task done")
    static final class TaskDoneCommand extends GatedCommand {
        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--result"}, description = "Summary of what was done")
        String result;

        @Override
        int execute(HuddleRuntime runtime) {
            HuddleRuntime.CompletionOutcome outcome = runtime.completeTask(taskId, result);
            if (outcome.administrativeOverride()) {
                parent.err().println("NOTE: task #" + taskId + " was not claimed by this instance; completed as override");
                parent.err().flush();
            }
            parent.printJson(outcome);
            return 0;
        }
    }

    @Command(name = "task-fail", description = "Mark a task failed")
    static final class TaskFailCommand extends GatedCommand {
        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--result"}, description = "Reason for failure")
        String result;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.failTask(taskId, result));
            return 0;
        }
    }

    @Command(name = "role-list", description = "List agent roles")
    static final class RoleListCommand extends GatedCommand {
        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.listRoles());
            return 0;
        }
    }

    @Command(name = "role-get", description = "Show one role with its system prompt")
    static final class RoleGetCommand extends GatedCommand {
        @Parameters(index = "0", description = "Role name")
        String name;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.getRole(name));
            return 0;
        }
    }

    @Command(name = "role-create", description = "Create or replace a role")
    static final class RoleCreateCommand extends GatedCommand {
        @Option(names = {"--name"}, required = true, description = "Role name")
        String name;

        @Option(names = {"--description"}, required = true, description = "Short description")
        String description;

        @Option(names = {"--prompt"}, required = true, description = "System prompt for this role")
        String prompt;

        @Option(names = {"--capabilities"}, description = "Comma-separated capabilities")
        String capabilities;

        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.saveRole(name, description, prompt, Jsons.splitCsv(capabilities)));
            return 0;
        }
    }

    @Command(name = "role-seed", description = "Install the built-in planner, coder, qa and reviewer roles")
    static final class RoleSeedCommand extends GatedCommand {
        @Override
        int execute(HuddleRuntime runtime) {
            parent.printJson(runtime.seedRoles());
            return 0;
        }
    }
}
