package io.operable.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.config.OperableConfig;
import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.auth.GoogleAuthTransport;
import io.operable.core.tool.ToolDispatcher;
import io.operable.core.tool.ToolRegistrationException;
import io.operable.core.tool.ToolRegistry;
import io.operable.core.tool.impl.DiagnosticToolGroups;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class OperableApplication {
    private static final Logger LOG = LoggerFactory.getLogger(OperableApplication.class);

    static final String NAME = "operable";
    static final String VERSION = "0.1.0";

    private OperableApplication() {
    }

    public static void main(String[] args) {
        OperableConfig config = OperableConfig.fromEnv();
        ObjectMapper mapper = new ObjectMapper();
        OkHttpClient httpClient = new OkHttpClient.Builder().callTimeout(config.httpTimeout()).build();

        GoogleAuthTransport credentials;
        try {
            credentials = GoogleAuthTransport.fromConfig(config.credentials(), httpClient);
        } catch (IllegalStateException e) {
            LOG.error("Failed to initialize credentials: {}", e.getMessage());
            System.exit(1);
            return;
        }
        LOG.info("Using {}", credentials.description());

        GoogleApiClient api = new GoogleApiClient(credentials, mapper, config.endpoints());
        ToolRegistry registry;
        try {
            registry = DiagnosticToolGroups.registry(api);
        } catch (ToolRegistrationException e) {
            LOG.error("Failed to register tools: {}", e.getMessage());
            System.exit(1);
            return;
        }

        ToolDispatcher dispatcher = new ToolDispatcher(registry);
        CliContext context = new CliContext(config, dispatcher, mapper, new McpServerRunner(dispatcher, mapper));
        System.exit(commandLine(context).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new OperableCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }
}
