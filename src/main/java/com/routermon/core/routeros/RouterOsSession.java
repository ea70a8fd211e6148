package com.routermon.core.routeros;

import com.routermon.core.DeviceSession;

import com.routermon.exceptions.ConnectivityException;

import com.routermon.exceptions.ProtocolException;

import com.routermon.utils.ExceptionUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.buffer.Buffer;

import io.vertx.core.json.JsonObject;

import io.vertx.core.net.NetSocket;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

import java.security.MessageDigest;

import java.util.ArrayList;

import java.util.HexFormat;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.atomic.AtomicBoolean;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * RouterOsSession - One authenticated RouterOS API connection

 * Responsibilities:
 * - Tag every command (.tag=N) so several commands can share the socket
 * - Collect !re rows per tag and settle the command on !done
 * - Map !trap to ProtocolException, !fatal and socket loss to ConnectivityException
 * - Enforce a per-command timeout; /cancel commands the caller abandons

 * Reply handling runs on the socket's event loop; pending commands live in a
 * concurrent map because execute() may be called from any context.
 */
public class RouterOsSession implements DeviceSession
{

    private static final Logger logger = LoggerFactory.getLogger(RouterOsSession.class);

    private final Vertx vertx;

    private final NetSocket socket;

    private final String target;

    private final long commandTimeoutMs;

    private final RouterOsWordCodec codec;

    private final Map<String, PendingCommand> pending = new ConcurrentHashMap<>();

    private final AtomicInteger tagSequence = new AtomicInteger();

    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Command awaiting its !done reply.
     */
    private static class PendingCommand
    {

        final String command;

        final Promise<List<JsonObject>> promise = Promise.promise();

        final List<JsonObject> rows = new ArrayList<>();

        String trapMessage;

        long timerId = -1;

        PendingCommand(String command)
        {
            this.command = command;
        }

    }

    RouterOsSession(Vertx vertx, NetSocket socket, String target, long commandTimeoutMs)
    {
        this.vertx = vertx;

        this.socket = socket;

        this.target = target;

        this.commandTimeoutMs = commandTimeoutMs;

        this.codec = new RouterOsWordCodec(this::handleSentence);

        socket.handler(this::handleData);

        socket.closeHandler(v ->
        {
            closed.set(true);

            failAll(new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
                "Connection to " + target + " closed"));
        });

        socket.exceptionHandler(cause ->
        {
            logger.debug("Socket error on {}: {}", target, cause.getMessage());

            failAll(ExceptionUtil.classifyConnectFailure(cause, target));
        });
    }

    @Override
    public Future<List<JsonObject>> execute(String command, Map<String, String> params)
    {
        return send(String.valueOf(tagSequence.incrementAndGet()), command, params);
    }

    @Override
    public Future<List<JsonObject>> execute(String command, Map<String, String> params, Future<?> abandon)
    {
        var tag = String.valueOf(tagSequence.incrementAndGet());

        var reply = send(tag, command, params);

        abandon.onComplete(signal -> cancel(tag));

        return reply;
    }

    private Future<List<JsonObject>> send(String tag, String command, Map<String, String> params)
    {
        if (closed.get())
        {
            return Future.failedFuture(new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
                "Session to " + target + " is closed"));
        }

        var words = new ArrayList<String>();

        words.add(command);

        for (var param : params.entrySet())
        {
            if (param.getKey().startsWith("?"))
            {
                words.add(param.getKey() + "=" + param.getValue());
            }
            else
            {
                words.add("=" + param.getKey() + "=" + param.getValue());
            }
        }

        words.add(".tag=" + tag);

        var pendingCommand = new PendingCommand(command);

        pending.put(tag, pendingCommand);

        pendingCommand.timerId = vertx.setTimer(commandTimeoutMs, id ->
        {
            if (pending.remove(tag) != null)
            {
                pendingCommand.promise.tryFail(new ConnectivityException(ConnectivityException.Reason.TIMEOUT,
                    "Command " + command + " on " + target + " timed out after " + commandTimeoutMs + "ms"));
            }
        });

        logger.trace("Sending {} (tag {}) to {}", command, tag, target);

        socket.write(RouterOsWordCodec.encodeSentence(words))
            .onFailure(cause ->
            {
                if (pending.remove(tag) != null)
                {
                    vertx.cancelTimer(pendingCommand.timerId);

                    pendingCommand.promise.tryFail(ExceptionUtil.classifyConnectFailure(cause, target));
                }
            });

        return pendingCommand.promise.future();
    }

    /**
     * Stops a pending command: /cancel frees it on the device and the late !trap/!done
     * for its tag is ignored.
     */
    private void cancel(String tag)
    {
        var pendingCommand = pending.remove(tag);

        if (pendingCommand == null)
        {
            return;
        }

        vertx.cancelTimer(pendingCommand.timerId);

        pendingCommand.promise.tryFail(new ProtocolException(pendingCommand.command, "cancelled"));

        if (closed.get())
        {
            return;
        }

        logger.debug("Cancelling {} (tag {}) on {}", pendingCommand.command, tag, target);

        execute("/cancel", Map.of("tag", tag))
            .onFailure(cause -> logger.debug("Cancel of tag {} on {} not confirmed: {}", tag, target, cause.getMessage()));
    }

    /**
     * Logs in with the post-6.43 plaintext method, falling back to the MD5
     * challenge when the device answers with =ret=.
     *
     * @param username login name
     * @param password decrypted password
     * @return Future completed once the device accepts the login
     */
    Future<Void> login(String username, String password)
    {
        var params = new LinkedHashMap<String, String>();

        params.put("name", username);

        params.put("password", password);

        return execute("/login", params)
            .compose(rows ->
            {
                var challenge = rows.stream()
                    .map(row -> row.getString("ret"))
                    .filter(value -> value != null && !value.isEmpty())
                    .findFirst();

                if (challenge.isEmpty())
                {
                    return Future.<Void>succeededFuture();
                }

                var response = new LinkedHashMap<String, String>();

                response.put("name", username);

                response.put("response", "00" + challengeResponse(password, challenge.get()));

                return execute("/login", response).<Void>mapEmpty();
            })
            .recover(cause ->
            {
                if (cause instanceof ProtocolException)
                {
                    return Future.failedFuture(new ConnectivityException(ConnectivityException.Reason.AUTH,
                        "Login rejected for " + username + "@" + target + ": " + cause.getMessage()));
                }

                return Future.failedFuture(cause);
            });
    }

    private static String challengeResponse(String password, String challengeHex)
    {
        try
        {
            var digest = MessageDigest.getInstance("MD5");

            digest.update((byte) 0);

            digest.update(password.getBytes(StandardCharsets.UTF_8));

            digest.update(HexFormat.of().parseHex(challengeHex));

            return HexFormat.of().formatHex(digest.digest());
        }
        catch (Exception exception)
        {
            throw new ProtocolException("/login", "Invalid login challenge: " + exception.getMessage());
        }
    }

    @Override
    public Future<Void> close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return Future.succeededFuture();
        }

        failAll(new ConnectivityException(ConnectivityException.Reason.UNREACHABLE, "Session to " + target + " closed"));

        return socket.close()
            .otherwise(cause ->
            {
                logger.debug("Ignoring close failure on {}: {}", target, cause.getMessage());

                return null;
            });
    }

    private void handleData(Buffer data)
    {
        try
        {
            codec.feed(data);
        }
        catch (ProtocolException exception)
        {
            logger.warn("Malformed reply from {}: {}", target, exception.getMessage());

            failAll(new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
                "Malformed reply from " + target + ": " + exception.getMessage()));

            close();
        }
    }

    private void handleSentence(List<String> words)
    {
        var type = words.get(0);

        if (type.equals("!fatal"))
        {
            var message = words.size() > 1 ? String.join(" ", words.subList(1, words.size())) : "fatal error";

            logger.warn("Device {} terminated the session: {}", target, message);

            failAll(new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
                "Device " + target + " terminated the session: " + message));

            close();

            return;
        }

        String tag = null;

        var attributes = new JsonObject();

        for (var index = 1; index < words.size(); index++)
        {
            var word = words.get(index);

            if (word.startsWith(".tag="))
            {
                tag = word.substring(5);
            }
            else if (word.startsWith("="))
            {
                var separator = word.indexOf('=', 1);

                if (separator < 0)
                {
                    attributes.put(word.substring(1), "");
                }
                else
                {
                    attributes.put(word.substring(1, separator), word.substring(separator + 1));
                }
            }
        }

        if (tag == null)
        {
            logger.debug("Ignoring untagged {} from {}", type, target);

            return;
        }

        var pendingCommand = pending.get(tag);

        if (pendingCommand == null)
        {
            logger.debug("Ignoring {} for settled tag {} from {}", type, tag, target);

            return;
        }

        if (type.equals("!re"))
        {
            pendingCommand.rows.add(attributes);
        }
        else if (type.equals("!trap"))
        {
            pendingCommand.trapMessage = attributes.getString("message", "command failed");
        }
        else if (type.equals("!done"))
        {
            pending.remove(tag);

            vertx.cancelTimer(pendingCommand.timerId);

            if (pendingCommand.trapMessage != null)
            {
                pendingCommand.promise.tryFail(new ProtocolException(pendingCommand.command, pendingCommand.trapMessage));

                return;
            }

            if (!attributes.isEmpty())
            {
                pendingCommand.rows.add(attributes);
            }

            pendingCommand.promise.tryComplete(pendingCommand.rows);
        }
        else if (!type.equals("!empty"))
        {
            logger.debug("Ignoring unknown reply {} from {}", type, target);
        }
    }

    private void failAll(Throwable cause)
    {
        for (var tag : new ArrayList<>(pending.keySet()))
        {
            var pendingCommand = pending.remove(tag);

            if (pendingCommand != null)
            {
                vertx.cancelTimer(pendingCommand.timerId);

                pendingCommand.promise.tryFail(cause);
            }
        }
    }

}
