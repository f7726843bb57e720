package io.caretaker.core.scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

/**
 * Turns {@code SIGINT} and {@code SIGTERM} into a shutdown request on a {@link ShutdownToken}.
 * Repeated signals are logged and otherwise ignored.
 */
public final class SignalShutdownHandler {
    private static final Logger LOG = LoggerFactory.getLogger(SignalShutdownHandler.class);
    static final List<String> SIGNALS = List.of("INT", "TERM");

    private final ShutdownToken token;

    public SignalShutdownHandler(ShutdownToken token) {
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    /**
     * @return the signals that could be installed on this platform
     */
    public List<String> install() {
        List<String> installed = new ArrayList<>();
        for (String name : SIGNALS) {
            try {
                Signal.handle(new Signal(name), signal -> onSignal("SIG" + signal.getName()));
                installed.add("SIG" + name);
            } catch (IllegalArgumentException e) {
                LOG.warn("Cannot handle SIG{} on this platform: {}", name, e.getMessage());
            }
        }
        return installed;
    }

    boolean onSignal(String signalName) {
        if (token.request(signalName)) {
            LOG.info("Received {}; the scheduler will stop after the current job", signalName);
            return true;
        }
        LOG.info("Received {} again; shutdown already in progress", signalName);
        return false;
    }
}
