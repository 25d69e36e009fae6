package com.questrail.muxbridge.runtime;

import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.config.SuperuserBridgeConfig;
import com.questrail.muxbridge.config.SuperuserBridgeConfigs;
import com.questrail.muxbridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.muxbridge.transport.FrameTransport;
import com.questrail.muxbridge.transport.stream.StreamFrameTransport;
import com.questrail.muxbridge.transport.tcp.netty.NettyTcpFrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: serves one session on stdio, or on one TCP connection.
 */
@Command(
        name = "muxbridge",
        mixinStandardHelpOptions = true,
        version = "muxbridge 0.1.0",
        description = "Multiplexing protocol bridge speaking framed channels on stdin/stdout"
)
public final class BridgeMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(BridgeMain.class);

    @Option(names = {"--privileged"}, description = "Run as the privileged peer of another bridge")
    boolean privileged;

    @Option(names = {"--bridges"}, paramLabel = "<file>",
            description = "JSON file with superuser bridge definitions (default: bundled definitions)")
    Path bridges;

    @Option(names = {"--tcp"}, paramLabel = "<port>",
            description = "Serve a single session on this TCP port instead of stdio")
    Integer tcpPort;

    public static void main(String[] args) {
        int code = new CommandLine(new BridgeMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        List<SuperuserBridgeConfig> configs = privileged
                ? List.of()
                : bridges != null ? SuperuserBridgeConfigs.load(bridges) : SuperuserBridgeConfigs.loadDefaults();

        BridgeRuntimeConfig config = BridgeRuntimeConfig.builder()
                .withPrivileged(privileged)
                .withSuperuserBridges(configs)
                .withEnvironment(System.getenv())
                .build();

        FrameTransport transport = transport();
        BridgeRuntime runtime = BridgeRuntime.builder()
                .withConfig(config)
                .withTransport(transport)
                .withObservabilitySink(new Slf4jBridgeObservabilitySink())
                .build();

        runtime.start();
        if (transport instanceof NettyTcpFrameTransport) {
            log.info("Waiting for a session on TCP port {}", ((NettyTcpFrameTransport) transport).awaitBoundPort());
        }
        while (!runtime.awaitTermination(1, TimeUnit.HOURS)) {
            log.debug("Session still running");
        }
        return 0;
    }

    private FrameTransport transport() {
        if (tcpPort != null) {
            return new NettyTcpFrameTransport(new InetSocketAddress(tcpPort));
        }

        PrintStream frames = new PrintStream(new FileOutputStream(FileDescriptor.out), false);
        // stdout carries frames only
        System.setOut(System.err);
        return new StreamFrameTransport(new FileInputStream(FileDescriptor.in), frames, "stdio");
    }
}
