package com.questrail.muxbridge.login;

import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.muxbridge.bus.BusInterface;
import com.questrail.muxbridge.bus.BusObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * {@code /LoginMessages}: one-shot messages handed over by the login process.
 *
 * <p>{@code Get} returns the messages (a JSON document as a string) until
 * {@code Dismiss} is called, and {@code "{}"} from then on or when there
 * were none.</p>
 */
public final class LoginMessages extends BusObject
{
    public static final String PATH = "/LoginMessages";
    public static final String INTERFACE = "cockpit.LoginMessages";
    public static final String ENVIRONMENT_VARIABLE = "COCKPIT_LOGIN_MESSAGES_MEMFD";

    private static final String EMPTY = "{}";
    private static final Path PROC_FDS = Path.of("/proc/self/fd");

    private static final Logger log = LoggerFactory.getLogger(LoginMessages.class);

    private final BusInterface descriptor;
    private String messages;

    private LoginMessages(String messages)
    {
        this.messages = messages;
        this.descriptor = BusInterface.builder(INTERFACE)
                .method("Get", List.of(), List.of("s"),
                        (args, call) -> call.reply(TextNode.valueOf(get())))
                .method("Dismiss", List.of(), List.of(),
                        (args, call) -> {
                            dismiss();
                            call.reply();
                        })
                .build();
    }

    public static LoginMessages of(String messages)
    {
        return new LoginMessages(messages);
    }

    public static LoginMessages none()
    {
        return new LoginMessages(null);
    }

    /**
     * Reads the messages from the inherited descriptor named by
     * {@value #ENVIRONMENT_VARIABLE}, if any.
     */
    public static LoginMessages fromEnvironment(Map<String, String> environment)
    {
        return fromEnvironment(environment, PROC_FDS);
    }

    static LoginMessages fromEnvironment(Map<String, String> environment, Path descriptors)
    {
        String fd = environment.get(ENVIRONMENT_VARIABLE);
        if (fd == null) {
            return none();
        }
        if (!fd.matches("[0-9]+")) {
            log.warn("Ignoring {}: '{}' is not a file descriptor", ENVIRONMENT_VARIABLE, fd);
            return none();
        }
        try {
            return of(new String(Files.readAllBytes(descriptors.resolve(fd)), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Unable to read login messages from descriptor {}", fd, e);
            return none();
        }
    }

    public String get()
    {
        return messages == null ? EMPTY : messages;
    }

    public void dismiss()
    {
        messages = null;
    }

    @Override
    protected List<BusInterface> interfaces()
    {
        return List.of(descriptor);
    }
}
