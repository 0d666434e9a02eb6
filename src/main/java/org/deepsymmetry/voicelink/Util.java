package org.deepsymmetry.voicelink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides utility functions.
 */
@SuppressWarnings("WeakerAccess")
public class Util {

    private static final Logger logger = LoggerFactory.getLogger(Util.class);

    /**
     * How long idle threads created by our executors are kept around before they exit.
     */
    private static final long IDLE_THREAD_SECONDS = 30;

    /**
     * Converts a signed byte to its unsigned int equivalent in the range 0-255.
     *
     * @param b a byte value to be considered an unsigned integer
     *
     * @return the unsigned version of the byte
     */
    public static int unsign(byte b) {
        return b & 0xff;
    }

    /**
     * Builds the bytes of an IPv4 subnet mask with the specified number of leading one bits.
     *
     * @param prefixLength the number of bits within an address that identify the network
     *
     * @return the four mask bytes, most significant first
     *
     * @throws IllegalArgumentException if {@code prefixLength} is not between 0 and 32
     */
    public static byte[] prefixLengthToMask(int prefixLength) {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("IPv4 prefix length must be between 0 and 32, got " + prefixLength);
        }
        final long mask = 0xffffffffL & (-1L << (32 - prefixLength));
        return new byte[] {(byte) (mask >> 24), (byte) (mask >> 16), (byte) (mask >> 8), (byte) mask};
    }

    /**
     * Counts the one bits in a subnet mask, giving the prefix length of the network it describes.
     *
     * @param mask the bytes of the subnet mask
     *
     * @return the number of bits set in the mask
     */
    public static int maskToPrefixLength(byte[] mask) {
        int result = 0;
        for (byte b : mask) {
            result += Integer.bitCount(unsign(b));
        }
        return result;
    }

    /**
     * Interpret an ISO-8601 timestamp as sent by a device. The devices' back ends often omit the zone
     * offset, in which case the time is taken to be UTC.
     *
     * @param text the timestamp text, may be {@code null}
     *
     * @return the corresponding instant, or {@code null} if there was no timestamp or it could not be parsed
     */
    public static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Unable to parse timestamp {}: {}", text, e.getMessage());
            return null;
        }
    }

    /**
     * Creates a thread factory whose threads are daemons, so they never keep the JVM alive, and are given
     * sequentially numbered names that make them easy to recognize in thread dumps.
     *
     * @param name the base name for the threads
     *
     * @return the thread factory
     */
    public static ThreadFactory daemonThreadFactory(final String name) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            final Thread thread = new Thread(null, runnable, name + " " + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Creates an executor with a single thread that delivers events to listeners in the order they were
     * submitted. The thread exits when it has been idle for a while, and is recreated when needed.
     *
     * @param name the name of the delivery thread
     *
     * @return the event delivery executor
     */
    public static ExecutorService newEventDeliveryExecutor(String name) {
        final ThreadPoolExecutor result = new ThreadPoolExecutor(1, 1, IDLE_THREAD_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreadFactory(name));
        result.allowCoreThreadTimeOut(true);
        return result;
    }

    /**
     * Creates a scheduler whose daemon threads exit when they have been idle for a while.
     *
     * @param name the base name of the scheduler threads
     * @param threads how many threads the scheduler may use at once
     *
     * @return the scheduler
     */
    public static ScheduledThreadPoolExecutor newScheduler(String name, int threads) {
        final ScheduledThreadPoolExecutor result = new ScheduledThreadPoolExecutor(threads, daemonThreadFactory(name));
        result.setKeepAliveTime(IDLE_THREAD_SECONDS, TimeUnit.SECONDS);
        result.allowCoreThreadTimeOut(true);
        result.setRemoveOnCancelPolicy(true);
        return result;
    }

    /**
     * Prevent instantiation.
     */
    private Util() {
        // Nothing to do.
    }
}
