package com.guidestore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.archive.ArchiveRecord;
import com.guidestore.cache.DocumentWatcher;
import com.guidestore.controllers.ArchiveController;
import com.guidestore.controllers.Controller;
import com.guidestore.controllers.DocumentController;
import com.guidestore.controllers.TaskController;
import com.guidestore.controllers.ToolController;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorDetails;
import com.guidestore.errors.GuideStoreException;
import com.guidestore.tools.ToolCallParser;
import com.guidestore.tools.ToolExecutionService;
import com.guidestore.tools.ToolSchemaRegistry;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), true, config.getLogLevel());
            logger = AppLogger.get();

            printBanner(config);

            StoreContext context = new StoreContext(config.getWorkspacePath(), objectMapper, Clock.systemUTC());
            logger.info("Workspace initialized: " + config.getWorkspacePath());

            if (config.isRecoverOnStart()) {
                List<ArchiveRecord> recovered = context.archives().recoverIncomplete();
                if (!recovered.isEmpty()) {
                    logger.info("Recovered " + recovered.size() + " interrupted archive move(s)");
                }
            }

            DocumentWatcher watcher = null;
            if (config.isWatchEnabled()) {
                watcher = new DocumentWatcher(context.workspace(), context.cache());
                watcher.start();
            }

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            registerControllers(app, context);
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("  File watching: " + (config.isWatchEnabled() ? "on" : "off"));
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            DocumentWatcher runningWatcher = watcher;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                if (runningWatcher != null) {
                    try {
                        runningWatcher.close();
                    } catch (IOException e) {
                        logger.warn("Failed to stop document watcher: " + e.getMessage());
                    }
                }
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Guide Store: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Guide Store v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerControllers(Javalin app, StoreContext context) {
        ObjectMapper mapper = context.objectMapper();
        ToolSchemaRegistry registry = ToolSchemaRegistry.defaults();
        ToolCallParser parser = new ToolCallParser(mapper, registry);
        ToolExecutionService executor = new ToolExecutionService(context.documents(), context.tasks(),
            context.archives(), mapper);
        List<Controller> controllers = List.of(
            new DocumentController(context.documents(), mapper),
            new TaskController(context.tasks(), mapper),
            new ArchiveController(context.archives(), mapper),
            new ToolController(registry, parser, executor, mapper)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(GuideStoreException.class, (e, ctx) -> {
            ErrorDetails details = ErrorDetails.from(e);
            if (details.getHttpStatus() >= 500) {
                logger.error(e.getCode() + ": " + e.getMessage(), e.getCause());
            } else {
                logger.warn(e.getCode() + ": " + e.getMessage());
            }
            ctx.status(details.getHttpStatus()).json(details);
        });

        app.exception(JsonProcessingException.class, (e, ctx) -> {
            logger.warn("Malformed request body: " + e.getOriginalMessage());
            ctx.status(400).json(Controller.errorBody(
                AddressingException.invalidParameter("body", e.getOriginalMessage())));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
