package com.missioncontrol.dispatch.cli;

import com.missioncontrol.core.config.RealtimeProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: mission-control serve
 * <p>
 * The web server is switched on by {@code MissionControlApplication#main} seeing "serve" in
 * the arguments, and {@link CliRunner} skips picocli in that case. This class only prints the
 * endpoints once the server is listening and keeps {@code serve} visible in the help output.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP, WebSocket and push-stream server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final RealtimeProperties properties;

    public ServeCommand(RealtimeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Mission Control running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api");
        System.out.println("  WebSocket:  ws://localhost:" + port + properties.getSocketPath());
        System.out.println("  Events:     http://localhost:" + port + "/api/events/stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
