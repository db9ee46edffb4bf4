package no.cantara.lagref.mcp;

import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for lagref-mcp.
 *
 * <pre>
 * Usage: lagref-mcp [corpus.yaml]
 * </pre>
 */
public class LagrefMcpCli {

    public static void main(String[] args) {
        Path corpusPath = Path.of("corpus.yaml");

        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                System.err.println("Usage: lagref-mcp [corpus.yaml]");
                return;
            }
            if (!arg.startsWith("-")) {
                corpusPath = Path.of(arg);
            }
        }

        if (!corpusPath.toFile().exists()) {
            System.err.println("[lagref-mcp] Error: corpus file not found at " + corpusPath);
            System.exit(1);
        }

        StdioServerTransportProvider transport = new StdioServerTransportProvider(LagrefMapper.MAPPER);

        McpSyncServer server;
        try {
            server = LagrefServer.createServer(corpusPath, transport);
        } catch (Exception e) {
            System.err.println("[lagref-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Transport handles I/O on daemon threads; exit when stdin closes.
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
