package com.petmind.bridge;

import com.petmind.shared.model.InboundEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * Console source. JSON lines are parsed as inbound events, other text is taken
 * as something the user said. Lines starting with {@code /} go to the command
 * handler, whose reply is printed.
 */
public class StdinEventSource implements EventSource {

    private final BufferedReader reader;
    private final PrintStream out;
    private final InboundEventParser parser;
    private final Function<String, String> commands;
    private volatile boolean running;
    private Thread readThread;
    private Runnable onStop;

    public StdinEventSource(BufferedReader reader, PrintStream out,
                            InboundEventParser parser, Function<String, String> commands) {
        this.reader = reader;
        this.out = out;
        this.parser = parser;
        this.commands = commands;
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    @Override
    public String id() {
        return "stdin";
    }

    @Override
    public void start(EventSink sink) {
        running = true;
        readThread = new Thread(() -> runLoop(sink), "stdin-source");
        readThread.setDaemon(true);
        readThread.start();
    }

    private void runLoop(EventSink sink) {
        out.println("PetMind console (JSON events or plain chat; /context, /stats, /clear, /quit)");
        while (running) {
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                if (!running) break;
                var msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                System.err.println("Input read error: " + msg);
                continue;
            }

            if (line == null) {
                finish();
                break;
            }
            var input = line.trim();
            if (input.isEmpty()) continue;
            if ("/quit".equals(input) || "/exit".equals(input)) {
                finish();
                break;
            }
            if (input.startsWith("/")) {
                out.println(commands.apply(input));
                continue;
            }
            if (input.startsWith("{")) {
                parser.parse(input).ifPresent(sink::accept);
            } else {
                sink.accept(new InboundEvent(MemoryBridge.STT_COMMAND, Map.of("text", input), Instant.now()));
            }
        }
    }

    private void finish() {
        stop();
        if (onStop != null) onStop.run();
    }

    @Override
    public void stop() {
        running = false;
        if (readThread != null && readThread != Thread.currentThread()) readThread.interrupt();
    }
}
