package com.gzh.webhooks.github;

import com.gzh.webhooks.config.AutomationConfig;
import com.gzh.webhooks.config.AutomationConfigLoader;
import com.gzh.webhooks.config.ConfigValidationException;
import com.gzh.webhooks.config.GlobalSettings;
import com.gzh.webhooks.config.WebhookServerConfig;
import com.gzh.webhooks.engine.RuleEngine;
import com.gzh.webhooks.github.client.GitHubClientConfig;
import com.gzh.webhooks.github.client.GitHubRestClient;
import com.gzh.webhooks.github.client.WebhookNotifier;
import com.gzh.webhooks.github.handler.DryRunActionHandler;
import com.gzh.webhooks.github.handler.NotificationHandler;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ActionHandlerRegistry;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.handler.TemplateRenderer;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.parser.EventParseException;
import com.gzh.webhooks.parser.EventParser;
import com.gzh.webhooks.rule.Action;
import com.gzh.webhooks.rule.Rule;
import com.gzh.webhooks.server.WebhookAutomationServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command-line launcher.
 *
 * <pre>
 *   webhook-automation server   config=rules.yaml [config-dir=rules.d] [port=8080] [path=/webhook]
 *                               [secret=...] [token=...] [api-url=...] [workers=N] [queue-size=N] [platform=GitHub]
 *   webhook-automation validate config=rules.yaml [config-dir=rules.d]
 *   webhook-automation test     config=rules.yaml [config-dir=rules.d] event=push.json type=push
 *   webhook-automation example
 * </pre>
 */
public final class WebhookAutomationMain {

    private static final Logger log = LoggerFactory.getLogger(WebhookAutomationMain.class);

    private static final String USAGE = """
            usage: webhook-automation <server|validate|test|example> [key=value ...]

            Modes:
              server    Receive webhooks and run matching rules
                          config=FILE config-dir=DIR port=8080 path=/webhook secret=... token=...
                          api-url=https://api.github.com workers=N queue-size=100 platform=GitHub
                          (secret defaults to $WEBHOOK_SECRET, token to $GITHUB_TOKEN,
                           workers to global.max_concurrency)
              validate  Check rule files and report per file
                          config=FILE config-dir=DIR
              test      Run the rules against a sample payload without side effects
                          config=FILE config-dir=DIR event=FILE type=EVENT_TYPE
              example   Print an example rule file
            """;

    private static final Set<String> CONFIG_ARGS = Set.of("config", "config-dir");
    private static final Set<String> SERVER_ARGS = Set.of("config", "config-dir", "port", "path", "secret", "token",
            "api-url", "workers", "queue-size", "platform");
    private static final Set<String> TEST_ARGS = Set.of("config", "config-dir", "event", "type");

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final Map<String, String> env;
    private final PrintStream out;
    private final AutomationConfigLoader loader = new AutomationConfigLoader();

    WebhookAutomationMain(Map<String, String> env, PrintStream out) {
        this.env = env;
        this.out = out;
    }

    public static void main(String[] args) {
        ExitCode exit = new WebhookAutomationMain(System.getenv(), System.out).run(args);
        if (exit != ExitCode.SUCCESS) {
            System.exit(exit.code());
        }
    }

    ExitCode run(String[] args) {
        if (args.length == 0) {
            out.println(USAGE.stripTrailing());
            return ExitCode.INVALID_ARGS;
        }
        String mode = args[0].toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            return switch (mode) {
                case "server"   -> server(CliArgsParser.toMap(rest, SERVER_ARGS));
                case "validate" -> validate(CliArgsParser.toMap(rest, CONFIG_ARGS));
                case "test"     -> test(CliArgsParser.toMap(rest, TEST_ARGS));
                case "example"  -> example();
                case "help", "--help", "-h" -> {
                    out.println(USAGE.stripTrailing());
                    yield ExitCode.SUCCESS;
                }
                default -> {
                    out.println("Unknown mode: " + mode);
                    out.println(USAGE.stripTrailing());
                    yield ExitCode.INVALID_ARGS;
                }
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            out.println("Invalid arguments: " + e.getMessage());
            return ExitCode.INVALID_ARGS;
        }
    }

    // ------------------------------------------------------------------
    // Modes
    // ------------------------------------------------------------------

    private ExitCode server(Map<String, String> args) {
        requireConfigSource(args);
        AutomationConfig config;
        try {
            config = loadConfig(args);
            loader.validate(config, GitHubHandlers.TYPES);
        } catch (IOException | ConfigValidationException e) {
            log.error("Failed to load automation rules: {}", e.getMessage());
            return ExitCode.FAILURE;
        }
        GlobalSettings global = config.getGlobal();

        WebhookServerConfig serverConfig = WebhookServerConfig.builder()
                .port(CliArgsParser.intValue(args, "port", 8080))
                .path(args.getOrDefault("path", "/webhook"))
                .sharedSecret(args.getOrDefault("secret", env.get("WEBHOOK_SECRET")))
                .platform(args.getOrDefault("platform", WebhookServerConfig.DEFAULT_PLATFORM))
                .workers(CliArgsParser.intValue(args, "workers", global.getMaxConcurrency()))
                .queueCapacity(CliArgsParser.intValue(args, "queue-size", 100))
                .build();
        GitHubClientConfig clientConfig = GitHubClientConfig.builder()
                .baseUrl(args.getOrDefault("api-url", GitHubClientConfig.DEFAULT_BASE_URL))
                .token(args.getOrDefault("token", env.get("GITHUB_TOKEN")))
                .build();

        TemplateRenderer renderer = new TemplateRenderer(global.getVariables());
        GitHubRestClient client   = new GitHubRestClient(clientConfig);
        WebhookNotifier notifier  = new WebhookNotifier();
        NotificationHandler notifications = new NotificationHandler(notifier, renderer);
        registerNotificationUrls(notifications, global.getNotificationUrls());

        ActionHandlerRegistry registry = GitHubHandlers.registry(GitHubHandlers.create(client, notifications, renderer));
        RuleEngine engine = new RuleEngine(registry);
        WebhookAutomationServer server = new WebhookAutomationServer(serverConfig, engine);
        CountDownLatch stopped = new CountDownLatch(1);
        try {
            engine.replaceRules(loader.toRules(config));
            server.start();
        } catch (Exception e) {
            log.error("Failed to start webhook automation server", e);
            closeAll(engine, client, notifier);
            return ExitCode.FAILURE;
        }
        log.info("Loaded {} automation rules, {} action handlers", engine.rules().size(), registry.size());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down webhook automation server");
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error while stopping server", e);
            } finally {
                closeAll(engine, client, notifier);
                stopped.countDown();
            }
        }, "webhook-shutdown"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return ExitCode.SUCCESS;
    }

    private ExitCode validate(Map<String, String> args) {
        requireConfigSource(args);
        List<Path> files = new ArrayList<>();
        try {
            if (args.containsKey("config")) {
                files.add(Path.of(args.get("config")));
            }
            if (args.containsKey("config-dir")) {
                files.addAll(loader.configFiles(Path.of(args.get("config-dir"))));
            }
        } catch (IOException e) {
            out.println("FAIL  " + e.getMessage());
            return ExitCode.FAILURE;
        }

        boolean ok = true;
        List<AutomationConfig> loaded = new ArrayList<>();
        for (Path file : files) {
            try {
                AutomationConfig config = loader.load(file);
                loader.validate(config, GitHubHandlers.TYPES);
                loaded.add(config);
                out.println("OK    " + file + " (" + config.getRules().size() + " rules)");
            } catch (IOException | ConfigValidationException e) {
                ok = false;
                out.println("FAIL  " + file + ": " + e.getMessage());
            }
        }
        if (ok && loaded.size() > 1) {
            try {
                loader.validate(AutomationConfig.merge(loaded), GitHubHandlers.TYPES);
            } catch (ConfigValidationException e) {
                ok = false;
                out.println("FAIL  combined rules: " + e.getMessage());
            }
        }
        out.println(ok ? "All rule files are valid" : "Validation failed");
        return ok ? ExitCode.SUCCESS : ExitCode.FAILURE;
    }

    private ExitCode test(Map<String, String> args) {
        requireConfigSource(args);
        String eventFile = args.get("event");
        String eventType = args.get("type");
        if (eventFile == null || eventType == null) {
            throw new IllegalArgumentException("test requires event=FILE and type=EVENT_TYPE");
        }

        AutomationConfig config;
        WebhookEvent event;
        try {
            config = loadConfig(args);
            event = new EventParser().parse(eventType, "test-delivery", Files.readAllBytes(Path.of(eventFile)), Map.of());
        } catch (IOException | ConfigValidationException | EventParseException e) {
            out.println("FAIL  " + e.getMessage());
            return ExitCode.FAILURE;
        }

        TemplateRenderer renderer = new TemplateRenderer(config.getGlobal().getVariables());
        Map<String, ActionHandler> dryRun = new LinkedHashMap<>();
        try (GitHubRestClient client = new GitHubRestClient(GitHubClientConfig.builder().build());
             WebhookNotifier notifier = new WebhookNotifier()) {
            GitHubHandlers.create(client, new NotificationHandler(notifier, renderer), renderer)
                    .forEach((type, handler) -> dryRun.put(type, new DryRunActionHandler(handler)));

            try (RuleEngine engine = new RuleEngine(GitHubHandlers.registry(dryRun))) {
                engine.replaceRules(loader.toRules(config));
                out.println("Testing event " + event.qualifiedType() + " from " + eventFile);
                out.println("Loaded " + engine.rules().size() + " rules");

                List<Rule> matched = engine.processEvent(event, ExecutionContext.background());
                for (Rule rule : matched) {
                    out.println("MATCH " + rule.getId() + " (" + rule.getName() + ")");
                    for (Action action : rule.getActions()) {
                        out.println("  -> " + action.getType() + (action.isAsync() ? " (async)" : ""));
                    }
                }
                out.println(matched.size() + " of " + engine.rules().size() + " rules matched");
            }
        } catch (IOException | ConfigValidationException | RuntimeException e) {
            out.println("FAIL  " + e.getMessage());
            return ExitCode.FAILURE;
        }
        return ExitCode.SUCCESS;
    }

    private ExitCode example() {
        try (InputStream in = WebhookAutomationMain.class.getResourceAsStream("/example-rules.yaml")) {
            if (in == null) {
                out.println("Example rule file is missing from the classpath");
                return ExitCode.FAILURE;
            }
            out.print(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            return ExitCode.SUCCESS;
        } catch (IOException e) {
            out.println("FAIL  " + e.getMessage());
            return ExitCode.FAILURE;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void requireConfigSource(Map<String, String> args) {
        if (!args.containsKey("config") && !args.containsKey("config-dir")) {
            throw new IllegalArgumentException("config=FILE or config-dir=DIR is required");
        }
    }

    private AutomationConfig loadConfig(Map<String, String> args) throws IOException, ConfigValidationException {
        List<AutomationConfig> configs = new ArrayList<>();
        if (args.containsKey("config")) {
            configs.add(loader.load(Path.of(args.get("config"))));
        }
        if (args.containsKey("config-dir")) {
            configs.addAll(loader.loadAll(Path.of(args.get("config-dir"))));
        }
        return AutomationConfig.merge(configs);
    }

    /** Registers the configured URLs, expanding {@code ${VAR}} from the environment, plus the well-known variables. */
    void registerNotificationUrls(NotificationHandler notifications, Map<String, String> configured) {
        Map<String, String> urls = new LinkedHashMap<>();
        putIfSet(urls, "slack", env.get("SLACK_WEBHOOK_URL"));
        putIfSet(urls, "discord", env.get("DISCORD_WEBHOOK_URL"));
        configured.forEach((type, url) -> putIfSet(urls, type, expand(url)));

        urls.forEach((type, url) -> {
            try {
                notifications.registerWebhook(type, url);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring notification URL for '{}': {}", type, e.getMessage());
            }
        });
    }

    /** Replaces {@code ${VAR}} references; returns {@code null} when a referenced variable is unset. */
    String expand(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = ENV_REFERENCE.matcher(value);
        StringBuilder expanded = new StringBuilder();
        while (m.find()) {
            String resolved = env.get(m.group(1));
            if (resolved == null || resolved.isBlank()) {
                return null;
            }
            m.appendReplacement(expanded, Matcher.quoteReplacement(resolved));
        }
        m.appendTail(expanded);
        return expanded.toString();
    }

    private static void putIfSet(Map<String, String> urls, String type, String url) {
        if (url != null && !url.isBlank()) {
            urls.put(type, url);
        }
    }

    private static void closeAll(AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
