package com.tradeguard.stream;

import com.tradeguard.exception.StreamBrokerException;
import io.lettuce.core.models.stream.ClaimedMessages;
import io.lettuce.core.Consumer;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XAutoClaimArgs;
import io.lettuce.core.XGroupCreateArgs;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.XTrimArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis Streams broker on a Lettuce client.
 *
 * <p>Non-blocking commands share one connection. Each consumer gets its own
 * connection for {@code XREADGROUP BLOCK}, since a blocked read would otherwise
 * stall every command pipelined behind it. Group creation uses {@code MKSTREAM}
 * from id {@code 0} and tolerates {@code BUSYGROUP}; reclaiming uses
 * {@code XAUTOCLAIM}, and age trimming uses {@code XTRIM MINID}.
 */
public class RedisStreamBroker implements StreamBroker {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamBroker.class);

    private final RedisClient redisClient;
    private final Map<String, StatefulRedisConnection<String, String>> readerConnections = new ConcurrentHashMap<>();

    private volatile StatefulRedisConnection<String, String> connection;

    public RedisStreamBroker(RedisClient redisClient) {
        this.redisClient = redisClient;
    }

    @Override
    public synchronized void initialize() {
        if (connection != null) {
            return;
        }
        try {
            StatefulRedisConnection<String, String> opened = redisClient.connect();
            String pong = opened.sync().ping();
            connection = opened;
            log.info("Redis stream broker connected: ping={}", pong);
        } catch (RedisException e) {
            throw new StreamBrokerException("Redis stream broker unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public StreamEntryId append(String stream, Map<String, String> fields, long maxLength) {
        String id = execute("XADD " + stream, commands ->
                commands.xadd(stream, XAddArgs.Builder.maxlen(maxLength).approximateTrimming(), fields));
        return StreamEntryId.parse(id);
    }

    @Override
    public void createGroup(String stream, String group) {
        try {
            commands().xgroupCreate(XReadArgs.StreamOffset.from(stream, "0"), group, XGroupCreateArgs.Builder.mkstream());
            log.info("Created consumer group {} on stream {}", group, stream);
        } catch (RedisCommandExecutionException e) {
            if (e.getMessage() != null && e.getMessage().startsWith("BUSYGROUP")) {
                log.debug("Consumer group {} already exists on stream {}", group, stream);
                return;
            }
            throw new StreamBrokerException("XGROUP CREATE " + stream + " " + group + " failed", e);
        } catch (RedisException e) {
            throw new StreamBrokerException("XGROUP CREATE " + stream + " " + group + " failed", e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, Duration block) {
        try {
            List<StreamMessage<String, String>> messages = readerConnection(consumer)
                    .sync()
                    .xreadgroup(
                            Consumer.from(group, consumer),
                            XReadArgs.Builder.count(count).block(block),
                            XReadArgs.StreamOffset.lastConsumed(stream));
            return toEntries(messages);
        } catch (RedisException e) {
            throw new StreamBrokerException("XREADGROUP " + stream + " failed", e);
        }
    }

    @Override
    public long acknowledge(String stream, String group, List<StreamEntryId> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String[] messageIds = ids.stream().map(StreamEntryId::toString).toArray(String[]::new);
        Long acked = execute("XACK " + stream, commands -> commands.xack(stream, group, messageIds));
        return acked != null ? acked : 0;
    }

    @Override
    public ClaimResult claimIdle(
            String stream, String group, String consumer, Duration minIdle, String cursor, int count) {
        ClaimedMessages<String, String> claimed = execute("XAUTOCLAIM " + stream, commands -> commands.xautoclaim(
                stream,
                XAutoClaimArgs.Builder.xautoclaim(Consumer.from(group, consumer), minIdle, cursor)
                        .count(count)));
        return new ClaimResult(toEntries(claimed.getMessages()), claimed.getId());
    }

    @Override
    public long trimByMinId(String stream, StreamEntryId minId) {
        Long removed = execute("XTRIM MINID " + stream, commands ->
                commands.xtrim(stream, XTrimArgs.Builder.minId(minId.toString())));
        return removed != null ? removed : 0;
    }

    @Override
    public long trimByMaxLength(String stream, long maxLength) {
        Long removed = execute("XTRIM MAXLEN " + stream, commands ->
                commands.xtrim(stream, XTrimArgs.Builder.maxlen(maxLength)));
        return removed != null ? removed : 0;
    }

    @Override
    public StreamInfo info(String stream) {
        return execute("stream info " + stream, commands -> {
            Long length = commands.xlen(stream);
            List<StreamMessage<String, String>> last =
                    commands.xrevrange(stream, Range.unbounded(), Limit.from(1));
            StreamEntryId lastId = last.isEmpty() ? null : StreamEntryId.parse(last.get(0).getId());
            return new StreamInfo(length != null ? length : 0, lastId);
        });
    }

    @Override
    public long pendingCount(String stream, String group) {
        return execute("XPENDING " + stream, commands -> commands.xpending(stream, group).getCount());
    }

    @Override
    public void close() {
        readerConnections.values().forEach(StatefulRedisConnection::close);
        readerConnections.clear();
        StatefulRedisConnection<String, String> current = connection;
        if (current != null) {
            current.close();
            connection = null;
        }
        log.info("Redis stream broker connections closed");
    }

    private <T> T execute(String description, Function<RedisCommands<String, String>, T> command) {
        try {
            return command.apply(commands());
        } catch (RedisException e) {
            throw new StreamBrokerException(description + " failed: " + e.getMessage(), e);
        }
    }

    private RedisCommands<String, String> commands() {
        StatefulRedisConnection<String, String> current = connection;
        if (current == null) {
            throw new StreamBrokerException("Redis stream broker used before initialize()");
        }
        return current.sync();
    }

    private StatefulRedisConnection<String, String> readerConnection(String consumer) {
        return readerConnections.computeIfAbsent(consumer, name -> {
            log.debug("Opening dedicated stream connection for consumer {}", name);
            return redisClient.connect();
        });
    }

    private static List<StreamEntry> toEntries(List<StreamMessage<String, String>> messages) {
        List<StreamEntry> entries = new ArrayList<>(messages.size());
        for (StreamMessage<String, String> message : messages) {
            if (message.getBody() == null) {
                // claimed id whose entry was already trimmed away
                continue;
            }
            entries.add(new StreamEntry(message.getStream(), StreamEntryId.parse(message.getId()), message.getBody()));
        }
        return entries;
    }
}
