// file: client/src/main/java/io/etcdlite/client/Cli.java
package io.etcdlite.client;

import io.etcdlite.core.ManualScheduler;
import io.etcdlite.core.Response;
import io.etcdlite.core.Verb;
import io.etcdlite.core.WatchTask;
import io.etcdlite.core.WatchUpdate;
import io.etcdlite.core.NodeJson;
import io.etcdlite.storage.FakeEtcdStore;
import io.etcdlite.storage.PreconditionChecker;
import io.etcdlite.storage.StoreConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interactive shell over an in-process store.
 *
 * Commands (one per line):
 *   get    <key>                       read a leaf
 *   ls     <dir>                       list a directory
 *   set    <key> <value> [ttl]         unconditional write
 *   mk     <key> <value> [ttl]         write only if absent
 *   update <key> <value> <prevIndex>   write only if at prevIndex
 *   push   <dir> <value>               create an index-named entry under dir
 *   rm     <key> [prevIndex]           delete, optionally conditional
 *   watch  <prefix>                    print changes under prefix
 *   unwatch <prefix>                   stop watching prefix
 *   help | quit
 *
 * The store runs on a {@link ManualScheduler} that is drained after every
 * command, so a command's response and the watch events it caused are printed
 * before the next command is read.
 */
public final class Cli {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final ManualScheduler scheduler = new ManualScheduler();
    private final FakeEtcdStore store;
    private final PrintStream out;
    private final Map<String, WatchTask> watches = new HashMap<>();

    Cli(StoreConfig config, PrintStream out) {
        this.store = new FakeEtcdStore(scheduler, config);
        this.out = out;
    }

    public static void main(String[] args) {
        CliConfig cfg = CliConfig.fromArgs(args);
        if (cfg.dumpEntries()) {
            enableFineLogging();
        }
        Cli cli = new Cli(StoreConfig.defaults().withDumpEntries(cfg.dumpEntries()), System.out);
        try (BufferedReader in = open(cfg.scriptPath())) {
            cli.run(in);
        } catch (IOException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(2);
        }
    }

    /**
     * Execute commands until end of input or "quit".
     *
     * @return number of commands that ran without error
     */
    int run(BufferedReader in) throws IOException {
        int ok = 0;
        for (String line; (line = in.readLine()) != null; ) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.equals("quit") || line.equals("exit")) {
                break;
            }
            try {
                execute(line);
                ok++;
            } catch (CliException | IllegalArgumentException | IllegalStateException e) {
                out.println("error: " + e.getMessage());
            }
        }
        return ok;
    }

    void execute(String line) {
        String[] t = line.trim().split("\\s+");
        switch (t[0]) {
            case "get" -> {
                expectArgs(t, 2, 2, "get <key>");
                send(t[1], Map.of(), Verb.GET);
            }
            case "ls" -> {
                expectArgs(t, 2, 2, "ls <dir>");
                send(t[1].endsWith("/") ? t[1] : t[1] + "/", Map.of(), Verb.GET);
            }
            case "set" -> {
                expectArgs(t, 3, 4, "set <key> <value> [ttl]");
                send(t[1], writeParams(t), Verb.PUT);
            }
            case "mk" -> {
                expectArgs(t, 3, 4, "mk <key> <value> [ttl]");
                Map<String, String> p = writeParams(t);
                p.put(PreconditionChecker.PREV_EXIST, "false");
                send(t[1], p, Verb.PUT);
            }
            case "update" -> {
                expectArgs(t, 4, 4, "update <key> <value> <prevIndex>");
                Map<String, String> p = new LinkedHashMap<>();
                p.put(FakeEtcdStore.VALUE, t[2]);
                p.put(PreconditionChecker.PREV_INDEX, t[3]);
                send(t[1], p, Verb.PUT);
            }
            case "push" -> {
                expectArgs(t, 3, 3, "push <dir> <value>");
                send(t[1], Map.of(FakeEtcdStore.VALUE, t[2]), Verb.POST);
            }
            case "rm" -> {
                expectArgs(t, 2, 3, "rm <key> [prevIndex]");
                Map<String, String> p = t.length == 3
                        ? Map.of(PreconditionChecker.PREV_INDEX, t[2])
                        : Map.of();
                send(t[1], p, Verb.DELETE);
            }
            case "watch" -> {
                expectArgs(t, 2, 2, "watch <prefix>");
                watch(t[1]);
            }
            case "unwatch" -> {
                expectArgs(t, 2, 2, "unwatch <prefix>");
                WatchTask task = watches.remove(t[1]);
                if (task == null) {
                    throw new CliException("not watching " + t[1]);
                }
                task.cancel();
                task.result().thenAccept(s -> out.println("unwatch " + t[1] + ": " + s.code()));
            }
            case "help" -> printHelp();
            default -> throw new CliException("unknown command: " + t[0]);
        }
        scheduler.runPending();
    }

    private void send(String key, Map<String, String> params, Verb verb) {
        store.generic(key, params, verb, this::print);
    }

    private void watch(String prefix) {
        if (watches.containsKey(prefix)) {
            throw new CliException("already watching " + prefix);
        }
        WatchTask task = new WatchTask();
        store.watch(prefix, updates -> printUpdates(prefix, updates), task);
        watches.put(prefix, task);
    }

    private void print(Response r) {
        if (r.status().ok()) {
            out.println("OK index=" + r.index() + " " + toJson(r.body()));
        } else {
            out.println(r.status() + " (index=" + r.index() + ")");
        }
    }

    private void printUpdates(String prefix, List<WatchUpdate> updates) {
        if (updates.isEmpty()) {
            out.println("watch " + prefix + ": (empty)");
            return;
        }
        for (WatchUpdate u : updates) {
            out.println("watch " + prefix + ": " + (u.exists() ? "exists " : "gone ")
                    + toJson(NodeJson.node(u.node())));
        }
    }

    private void printHelp() {
        out.println("""
            get <key> | ls <dir> | set <key> <value> [ttl] | mk <key> <value> [ttl]
            update <key> <value> <prevIndex> | push <dir> <value> | rm <key> [prevIndex]
            watch <prefix> | unwatch <prefix> | help | quit""");
    }

    private static Map<String, String> writeParams(String[] t) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put(FakeEtcdStore.VALUE, t[2]);
        if (t.length == 4) {
            p.put(FakeEtcdStore.TTL, t[3]);
        }
        return p;
    }

    private static void expectArgs(String[] t, int min, int max, String usage) {
        if (t.length < min || t.length > max) {
            throw new CliException("usage: " + usage);
        }
    }

    private static String toJson(JsonNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render response", e);
        }
    }

    private static BufferedReader open(String scriptPath) throws IOException {
        if (scriptPath == null) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return Files.newBufferedReader(Path.of(scriptPath), StandardCharsets.UTF_8);
    }

    private static void enableFineLogging() {
        Logger root = Logger.getLogger("io.etcdlite");
        root.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }

    /** User-facing command error. */
    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
