package io.github.hide212131.langchain4j.agentcore.app.cli;

import io.github.hide212131.langchain4j.agentcore.runtime.AgentConfiguration;
import io.github.hide212131.langchain4j.agentcore.runtime.AgentConfigurationLoader;
import io.github.hide212131.langchain4j.agentcore.runtime.ExecutionMode;
import io.github.hide212131.langchain4j.agentcore.runtime.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.agentcore.runtime.coordinator.Coordinator;
import io.github.hide212131.langchain4j.agentcore.runtime.coordinator.CoordinatorFactory;
import io.github.hide212131.langchain4j.agentcore.runtime.job.InMemoryJobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.InteractivePermissionBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionResponse;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.LangChain4jCompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.DirectSandbox;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.DockerSandbox;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.LoadedSkill;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.MarketplaceSkill;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.SkillCatalog;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * PicoCLI からエージェント実行コアを呼び出すエントリポイント。
 */
@Command(name = "agent", mixinStandardHelpOptions = true, description = "Run the agent execution core")
public final class AgentCliApp implements Runnable {

    private static final String LOGGING_CONFIG = "/logging.properties";

    public static void main(String[] args) {
        configureLogging();
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(System.in);
    }

    static CommandLine commandLineInstance(InputStream input) {
        CommandLine cmd = new CommandLine(new AgentCliApp());
        cmd.addSubcommand("run", new RunCommand(
                new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))));
        cmd.addSubcommand("skills", new SkillsCommand());
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    static void configureLogging() {
        try (InputStream config = AgentCliApp.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException ex) {
            System.err.println("Warning: failed to load logging configuration: " + ex.getMessage());
        }
    }

    @Command(name = "run", description = "Route a query and execute it with tools and skills")
    static final class RunCommand implements Callable<Integer> {

        @Option(names = "--query", description = "Query to execute")
        String query;

        @Option(names = "--query-file", description = "Path to a file containing the query")
        Path queryFile;

        @Option(names = "--fast", description = "Skip classification and planning")
        boolean fast;

        @Option(names = "--mode", description = "Execution mode: sandbox, direct or flexible")
        String mode;

        @Option(names = "--workspace", description = "Workspace directory", defaultValue = ".")
        Path workspace;

        @Option(names = "--skills-dir", description = "Path to skills directory", defaultValue = "skills")
        Path skillsDir;

        @Option(names = "--config", description = "Agent configuration YAML")
        Path config;

        @Option(names = "--dry-run", description = "Use fake LLM to run without external API calls")
        boolean dryRun;

        @Option(names = "--autonomous", description = "Approve every permission request without asking")
        boolean autonomous;

        @Spec
        CommandSpec commandSpec;

        private final BufferedReader input;

        RunCommand(BufferedReader input) {
            this.input = input;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();
            String resolvedQuery;
            try {
                resolvedQuery = resolveQuery();
            } catch (IllegalArgumentException ex) {
                err.println("Error: " + ex.getMessage());
                return 2;
            }

            AgentConfiguration configuration;
            CompletionProvider provider;
            try {
                configuration = configuration(out);
                provider = dryRun
                        ? LangChain4jCompletionProvider.fake()
                        : LangChain4jCompletionProvider
                                .forConfiguration(new LlmConfigurationLoader().load(configuration));
            } catch (IllegalArgumentException | IllegalStateException ex) {
                err.println("Error: " + ex.getMessage());
                return 2;
            }

            List<String> warnings = new ArrayList<>();
            Path resolvedSkillsDir = toAbsolute(skillsDir);
            List<LoadedSkill> skills = Files.isDirectory(resolvedSkillsDir)
                    ? SkillCatalog.loadAll(resolvedSkillsDir, warnings)
                    : List.of();
            warnings.forEach(warning -> out.println("Warning: " + warning));

            ConsoleEventPrinter printer = new ConsoleEventPrinter(out, err);
            PermissionBroker broker;
            InteractivePermissionBroker interactive = null;
            if (configuration.autonomous()) {
                broker = PermissionBroker.autonomous();
            } else {
                interactive = new InteractivePermissionBroker(printer);
                InteractivePermissionBroker target = interactive;
                printer.onApprovalRequired(request -> target.resolve(request.id(), ask(out, request)));
                broker = interactive;
            }

            Coordinator coordinator = CoordinatorFactory.create(new CoordinatorFactory.Components(configuration,
                    provider, broker, printer, new InMemoryJobStore(), new DockerSandbox(), new DirectSandbox(),
                    skills));
            String sessionId = UUID.randomUUID().toString();
            Job job;
            try {
                job = coordinator.run(sessionId, resolvedQuery, fast);
            } finally {
                if (interactive != null) {
                    interactive.cancelSession(sessionId);
                }
            }
            out.println("Job " + job.id() + ": " + job.status().value());
            return job.status() == JobStatus.COMPLETED ? 0 : 1;
        }

        private String resolveQuery() {
            if (queryFile != null) {
                Path path = toAbsolute(queryFile);
                if (!Files.isRegularFile(path)) {
                    throw new IllegalArgumentException("query file not found: " + path);
                }
                String content;
                try {
                    content = Files.readString(path, StandardCharsets.UTF_8);
                } catch (IOException ex) {
                    throw new UncheckedIOException("query file could not be read: " + path, ex);
                }
                if (content.isBlank()) {
                    throw new IllegalArgumentException("query file is empty: " + path);
                }
                return content.trim();
            }
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("--query or --query-file is required");
            }
            return query.trim();
        }

        private AgentConfiguration configuration(PrintWriter out) {
            Path workspacePath = toAbsolute(workspace);
            AgentConfiguration configuration;
            if (config != null) {
                AgentConfigurationLoader.LoadResult result = new AgentConfigurationLoader()
                        .load(toAbsolute(config), workspacePath);
                result.warnings().forEach(warning -> out.println("Warning: " + warning));
                configuration = result.configuration();
            } else {
                configuration = AgentConfiguration.defaults(workspacePath);
            }
            if (mode != null) {
                configuration = configuration.withExecutionMode(ExecutionMode.parse(mode));
            }
            if (autonomous) {
                configuration = configuration.withAutonomous(true);
            }
            return configuration;
        }

        private PermissionResponse ask(PrintWriter out, PermissionRequest request) {
            out.print("Allow? [y]es / [n]o / [a]lways: ");
            out.flush();
            String answer;
            try {
                answer = input.readLine();
            } catch (IOException ex) {
                throw new UncheckedIOException("failed to read approval answer", ex);
            }
            if (answer == null) {
                return PermissionResponse.DENY;
            }
            return switch (answer.trim().toLowerCase(Locale.ROOT)) {
                case "y", "yes" -> PermissionResponse.ALLOW;
                case "a", "always" -> PermissionResponse.ALLOW_ALWAYS;
                default -> PermissionResponse.DENY;
            };
        }
    }

    @Command(name = "skills", description = "List skills found in a directory")
    static final class SkillsCommand implements Callable<Integer> {

        @Option(names = "--skills-dir", description = "Path to skills directory", defaultValue = "skills")
        Path skillsDir;

        @Spec
        CommandSpec commandSpec;

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            Path resolved = toAbsolute(skillsDir);
            if (!Files.isDirectory(resolved)) {
                commandSpec.commandLine().getErr().println("Warning: skills directory not found at " + resolved);
                return 1;
            }
            SkillCatalog.LoadResult result = SkillCatalog.list(resolved);
            result.warnings().forEach(warning -> out.println("Warning: " + warning));
            for (MarketplaceSkill skill : result.skills()) {
                out.println(skill.name() + " - " + skill.displayTitle()
                        + skill.categoryValue().map(category -> " [" + category + "]").orElse(""));
            }
            out.println(result.skills().size() + " skill(s) found");
            return 0;
        }
    }

    private static Path toAbsolute(Path path) {
        return path.isAbsolute() ? path.normalize() : Path.of("").toAbsolutePath().resolve(path).normalize();
    }
}
