package com.questrail.muxbridge.test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.impl.DefaultFrameDecoder;
import com.questrail.muxbridge.codec.impl.DefaultFrameEncoder;
import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.protocol.Command;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.runtime.BridgeRuntime;
import com.questrail.muxbridge.transport.stream.StreamFrameTransport;
import com.questrail.muxbridge.util.Jsons;

import java.io.BufferedInputStream;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A stand-in for {@code sudo muxbridge --privileged}.
 *
 * <p>When {@code PSEUDO_PASSWORD} is set in its environment the peer first
 * asks for it with an {@code authorize} challenge, and gives up with a
 * message on stderr if the answer is wrong. It then serves a privileged
 * bridge on the same streams.</p>
 */
public final class PseudoPeer {

    public static final String LABEL = "pseudo";
    public static final String PASSWORD_VARIABLE = "PSEUDO_PASSWORD";
    public static final String PROMPT = "can haz pw?";
    public static final String COOKIE = "pseudo-1";
    public static final String BAD_PASSWORD = "pseudo says: Bad password";

    private PseudoPeer() {
    }

    public static int run(InputStream in, OutputStream out, OutputStream err, Map<String, String> env)
            throws IOException, InterruptedException {
        BufferedInputStream input = new BufferedInputStream(in);

        String password = env.get(PASSWORD_VARIABLE);
        if (password != null) {
            ObjectNode challenge = ControlMessages.command(Command.AUTHORIZE);
            challenge.put("cookie", COOKIE);
            challenge.put("prompt", PROMPT);
            out.write(new DefaultFrameEncoder().encode(Frame.control(Jsons.toBytes(challenge))));
            out.flush();

            Optional<Frame> answer = new DefaultFrameDecoder().decode(input);
            String response = null;
            if (answer.isPresent() && answer.get().isControl()) {
                ObjectNode reply = Jsons.parseObject(answer.get().payload());
                if (COOKIE.equals(Jsons.text(reply, "cookie"))) {
                    response = Jsons.text(reply, "response");
                }
            }
            if (!password.equals(response)) {
                err.write((BAD_PASSWORD + "\n").getBytes(StandardCharsets.UTF_8));
                err.flush();
                out.close();
                return 1;
            }
        }

        BridgeRuntime runtime = BridgeRuntime.builder()
                .withConfig(BridgeRuntimeConfig.builder()
                        .withPrivileged(true)
                        .withEnvironment(env)
                        .build())
                .withTransport(new StreamFrameTransport(input, out, LABEL))
                .build();
        runtime.start();
        while (!runtime.awaitTermination(1, TimeUnit.MINUTES)) {
            // keep serving until the parent hangs up
        }
        return 0;
    }

    public static void main(String[] args) throws Exception {
        OutputStream stdout = new FileOutputStream(FileDescriptor.out);
        System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8));
        int status = run(new FileInputStream(FileDescriptor.in), stdout,
                new FileOutputStream(FileDescriptor.err), System.getenv());
        System.exit(status);
    }
}
