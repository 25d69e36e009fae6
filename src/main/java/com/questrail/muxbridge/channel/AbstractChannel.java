package com.questrail.muxbridge.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.observability.ChannelTransitionEvent;
import com.questrail.muxbridge.protocol.Command;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.util.Jsons;

import java.time.Instant;
import java.util.Objects;

/**
 * AbstractChannel
 * =============================================================================
 * Base class holding the lifecycle bookkeeping shared by all endpoints.
 *
 * <p>Subclasses implement the {@code do*} hooks and talk back to the front end
 * through {@link #ready()}, {@link #sendData(byte[])}, {@link #done()} and
 * {@link #close(String, String)}. Every outbound frame goes through the
 * channel's {@link FlowControlGate}.</p>
 *
 * <p>Once the channel is {@link ChannelState#CLOSED} nothing more is sent and
 * all inbound traffic is ignored.</p>
 */
public abstract class AbstractChannel implements ChannelEndpoint
{
    protected final ChannelContext context;

    private ChannelState state = ChannelState.OPENING;
    private boolean doneSent;
    private boolean doneReceived;

    protected AbstractChannel(ChannelContext context)
    {
        this.context = Objects.requireNonNull(context, "context");
    }

    // ---------------------------------------------------------------------
    // ChannelEndpoint
    // ---------------------------------------------------------------------

    @Override
    public final String id()
    {
        return context.request().channel();
    }

    @Override
    public final String payload()
    {
        return context.request().payload();
    }

    @Override
    public final String group()
    {
        return context.request().group();
    }

    @Override
    public final ChannelState state()
    {
        return state;
    }

    @Override
    public final void open() throws ChannelOpenException
    {
        try {
            doOpen(context.request().options());
        } catch (ChannelOpenException e) {
            if (state == ChannelState.OPENING) {
                throw e;
            }
            close(e.problem(), e.getMessage());
        }
    }

    @Override
    public final void receiveData(byte[] data)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        markActive();
        doData(data);
    }

    @Override
    public final void receiveDone()
    {
        if (state == ChannelState.CLOSED || doneReceived) {
            return;
        }
        doneReceived = true;
        transition(ChannelState.DONE_RECEIVED, null);
        doDone();
    }

    @Override
    public final void receiveClose(String problem)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        doClose(problem);
    }

    @Override
    public void receivePing(ObjectNode message)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        ObjectNode pong = message.deepCopy();
        pong.put("command", Command.PONG.wireName());
        context.gate().sendControl(pong);
    }

    @Override
    public final void freeze()
    {
        context.gate().freeze();
    }

    @Override
    public final void thaw()
    {
        context.gate().thaw();
    }

    @Override
    public final boolean isFrozen()
    {
        return context.gate().isFrozen();
    }

    @Override
    public final void close(String problem)
    {
        close(problem, null);
    }

    @Override
    public final void abandon()
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        transition(ChannelState.CLOSED, null);
        onClosing();
        context.gate().discard();
    }

    // ---------------------------------------------------------------------
    // Hooks
    // ---------------------------------------------------------------------

    /**
     * Starts the endpoint. Implementations normally finish by calling {@link #ready()}.
     */
    protected abstract void doOpen(ObjectNode options) throws ChannelOpenException;

    protected void doData(byte[] data) {}

    protected void doDone() {}

    /**
     * The front end closed the channel. Default: close back cleanly.
     */
    protected void doClose(String problem)
    {
        close(null);
    }

    /**
     * Runs once when the channel closes or is abandoned, before anything is written.
     */
    protected void onClosing() {}

    /**
     * This side is closing the channel with {@code problem}; runs before
     * {@link #onClosing()}. Not called for a close relayed on behalf of
     * someone else.
     */
    protected void onLocalClose(String problem) {}

    // ---------------------------------------------------------------------
    // Helpers for subclasses
    // ---------------------------------------------------------------------

    protected final void ready()
    {
        relayControl(ControlMessages.forChannel(Command.READY, id()));
    }

    protected final void sendData(byte[] data)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        markActive();
        context.gate().sendData(data);
    }

    protected final void done()
    {
        relayControl(ControlMessages.forChannel(Command.DONE, id()));
    }

    protected final void close(String problem, String message)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        onLocalClose(problem);
        relayControl(ControlMessages.close(id(), problem, message));
    }

    /**
     * Sends a control message for this channel, updating the lifecycle for
     * {@code ready}, {@code done} and {@code close}. The message's
     * {@code channel} field is set to this channel's id.
     */
    protected final void relayControl(ObjectNode message)
    {
        if (state == ChannelState.CLOSED) {
            return;
        }
        message.put("channel", id());

        Command command = Command.fromWireName(Jsons.text(message, "command")).orElse(null);
        if (command == Command.READY) {
            if (state != ChannelState.OPENING) {
                return;
            }
            transition(ChannelState.READY, null);
            context.gate().sendControl(message);
        }
        else if (command == Command.DONE) {
            if (doneSent) {
                return;
            }
            doneSent = true;
            transition(ChannelState.DONE_SENT, null);
            context.gate().sendControl(message);
        }
        else if (command == Command.CLOSE) {
            transition(ChannelState.CLOSED, Jsons.text(message, "problem"));
            onClosing();
            context.gate().sendTerminal(message);
        }
        else {
            context.gate().sendControl(message);
        }
    }

    protected final boolean isClosed()
    {
        return state == ChannelState.CLOSED;
    }

    private void markActive()
    {
        if (state == ChannelState.READY) {
            transition(ChannelState.ACTIVE, null);
        }
    }

    private void transition(ChannelState to, String problem)
    {
        ChannelState from = state;
        state = to;
        context.sink().onChannelTransition(
                new ChannelTransitionEvent(Instant.now(), id(), payload(), from, to, problem));
    }
}
