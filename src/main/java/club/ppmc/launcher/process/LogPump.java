/**
 * LogPump.java
 *
 * 持续读取一个子进程的标准输出和标准错误，将原始字节按行切分、解码、分类，
 * 分配运行内递增的序号后交给下游（LogBroadcaster）。
 * 每个输出流在独立的线程中读取，直到两个流都到达末尾，或监管方调用 close() 进行拆除。
 * 下游的缓冲与背压不属于本类的职责：只要子进程在输出，这里就持续产出记录。
 */
package club.ppmc.launcher.process;

import club.ppmc.launcher.model.LogLevel;
import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.LogStream;
import club.ppmc.launcher.service.LogClassifier;
import club.ppmc.launcher.util.LineDecoder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LogPump implements AutoCloseable {

    /** 超过此长度仍未遇到换行符时，强制切分为一条记录。 */
    static final int MAX_LINE_BYTES = 64 * 1024;

    private static final int READ_CHUNK_SIZE = 8192;

    private final String runId;
    private final LogClassifier classifier;
    private final LineDecoder decoder;
    private final Consumer<LogRecord> sink;

    private final Object emitLock = new Object();
    private long sequence; // 由 emitLock 保护

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile List<InputStream> streams = List.of();
    private volatile CompletableFuture<Void> completion;

    public LogPump(String runId, LogClassifier classifier, LineDecoder decoder, Consumer<LogRecord> sink) {
        this.runId = runId;
        this.classifier = classifier;
        this.decoder = decoder;
        this.sink = sink;
    }

    /**
     * 开始在给定的执行器上读取两个输出流。
     *
     * @return 一个在两个流都读取完毕后完成的 Future。
     */
    public CompletableFuture<Void> start(InputStream stdout, InputStream stderr, Executor executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("日志读取器已经启动。");
        }
        this.streams = List.of(stdout, stderr);
        CompletableFuture<Void> stdoutReader =
                CompletableFuture.runAsync(() -> pump(stdout, LogStream.STDOUT), executor);
        CompletableFuture<Void> stderrReader =
                CompletableFuture.runAsync(() -> pump(stderr, LogStream.STDERR), executor);
        this.completion = CompletableFuture.allOf(stdoutReader, stderrReader);
        return completion;
    }

    private void pump(InputStream input, LogStream stream) {
        var line = new ByteArrayOutputStream(256);
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        try (input) {
            int read;
            while ((read = input.read(chunk)) != -1) {
                int lineStart = 0;
                for (int i = 0; i < read; i++) {
                    if (chunk[i] == '\n') {
                        line.write(chunk, lineStart, i - lineStart);
                        emitLine(line, stream);
                        lineStart = i + 1;
                    }
                }
                line.write(chunk, lineStart, read - lineStart);
                while (line.size() >= MAX_LINE_BYTES) {
                    splitOverlongLine(line, stream);
                }
            }
            // 进程退出前最后一行可能没有换行符
            emitLine(line, stream);
        } catch (IOException e) {
            // 进程被杀死或流被主动关闭时，这里会抛出IO异常，是正常现象
            if (closed.get()) {
                log.debug("运行 {} 的 {} 流已被关闭: {}", runId, stream, e.getMessage());
            } else {
                log.warn("读取运行 {} 的 {} 流时出错: {}", runId, stream, e.getMessage());
            }
        } finally {
            log.debug("运行 {} 的 {} 流读取线程已结束。", runId, stream);
        }
    }

    private void emitLine(ByteArrayOutputStream line, LogStream stream) {
        if (line.size() == 0) {
            return;
        }
        byte[] bytes = line.toByteArray();
        line.reset();
        emitText(decoder.decode(bytes), stream);
    }

    /**
     * 输出超长行的前 MAX_LINE_BYTES 字节（退到字符边界），其余部分留在缓冲区中。
     */
    private void splitOverlongLine(ByteArrayOutputStream line, LogStream stream) {
        byte[] bytes = line.toByteArray();
        int cut = codePointBoundary(bytes, MAX_LINE_BYTES);
        line.reset();
        line.write(bytes, cut, bytes.length - cut);
        emitText(decoder.decode(Arrays.copyOf(bytes, cut)), stream);
    }

    /**
     * 返回不超过 limit 的切分位置，保证不会切断一个UTF-8多字节字符。
     * 无法识别为UTF-8时直接返回 limit。
     */
    static int codePointBoundary(byte[] bytes, int limit) {
        int lead = limit - 1;
        while (lead > 0 && (bytes[lead] & 0xC0) == 0x80 && limit - lead < 4) {
            lead--;
        }
        int b = bytes[lead] & 0xFF;
        int length;
        if (b < 0x80) {
            length = 1;
        } else if ((b & 0xE0) == 0xC0) {
            length = 2;
        } else if ((b & 0xF0) == 0xE0) {
            length = 3;
        } else if ((b & 0xF8) == 0xF0) {
            length = 4;
        } else {
            return limit;
        }
        return lead + length > limit && lead > 0 ? lead : limit;
    }

    private void emitText(String text, LogStream stream) {
        if (text.isEmpty() || closed.get()) {
            return;
        }
        LogLevel level = classifier.classify(text);
        synchronized (emitLock) {
            var record = new LogRecord(runId, ++sequence, Instant.now(), level, stream, text);
            log.debug("[LOG] #{} {}", record.sequence(), text);
            try {
                sink.accept(record);
            } catch (RuntimeException e) {
                // 下游出错不能中断读取，否则子进程会因管道写满而挂起
                log.error("分发运行 {} 的日志 #{} 时出错", runId, record.sequence(), e);
            }
        }
    }

    /**
     * 等待两个输出流读取完毕。
     *
     * @return 如果在超时前读取完毕返回 true。
     */
    public boolean awaitDrained(Duration timeout) {
        CompletableFuture<Void> future = this.completion;
        if (future == null) {
            return true;
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.warn("运行 {} 的日志读取异常结束", runId, e.getCause());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long emittedCount() {
        synchronized (emitLock) {
            return sequence;
        }
    }

    /**
     * 停止产出记录并关闭两个输出流。重复调用没有副作用。
     * 关闭之后读取到的内容会被丢弃，不会再进入下游。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (InputStream stream : streams) {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("关闭运行 {} 的输出流时出错: {}", runId, e.getMessage());
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
