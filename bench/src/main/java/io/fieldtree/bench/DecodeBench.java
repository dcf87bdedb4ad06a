package io.fieldtree.bench;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fieldtree.codec.ResponseDecoder;
import io.fieldtree.codec.ScalarRegistry;
import io.fieldtree.codec.Variables;
import io.fieldtree.core.document.Document;
import io.fieldtree.core.document.FieldSelection;
import io.fieldtree.core.document.FragmentDefinition;
import io.fieldtree.core.document.FragmentSpread;
import io.fieldtree.core.document.InlineFragment;
import io.fieldtree.core.document.OperationDefinition;
import io.fieldtree.core.merge.CompilerOptions;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.PolymorphicFallback;
import io.fieldtree.core.tree.TreeCompiler;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decode micro-benchmark: N threads decode the same payload against one shared canonical tree.
 *
 * Usage:
 *   java -cp bench.jar io.fieldtree.bench.DecodeBench \
 *     --threads 8 \
 *     --duration-seconds 30 \
 *     --items 200
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-decode latency samples:
 *       op,success,latency_ms
 */
public final class DecodeBench {

    private static final class Sample {
        final boolean ok;
        final double latencyMs;

        Sample(boolean ok, double latencyMs) {
            this.ok = ok;
            this.latencyMs = latencyMs;
        }
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "30"));
        int items = Integer.parseInt(cfg.getOrDefault("items", "200"));

        runBenchmark(threads, durationSeconds, items);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void runBenchmark(int threads, int durationSeconds, int items) throws Exception {
        CanonicalTree tree = new TreeCompiler(schema(), CompilerOptions.defaults())
                .compileOperation(document(), "Roster", PolymorphicFallback.CATCH_ALL);
        JsonNode payload = payload(items, 42L);
        ResponseDecoder decoder = new ResponseDecoder(ScalarRegistry.defaults());
        Variables variables = Variables.forTree(tree, Map.of());

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        Runnable worker = () -> {
            while (System.nanoTime() < endTime) {
                long start = System.nanoTime();
                boolean ok = false;
                try {
                    ok = decoder.decode(tree, payload, variables).size() == 1;
                } catch (RuntimeException e) {
                    System.err.println("decode failed: " + e.getMessage());
                } finally {
                    double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
                    samples.add(new Sample(ok, latencyMs));
                    opCount.incrementAndGet();
                }
            }
        };

        for (int i = 0; i < threads; i++) {
            exec.submit(worker);
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        summarizeAndPrint(all, opCount.get(), durationSeconds, items);
    }

    // ---------- workload ----------

    private static TypeGraph schema() {
        return TypeGraph.builder()
                .object("Query", "roster", "[Character!]!")
                .interfaceType("Character", Set.of("Human", "Droid", "Wookiee"),
                        "id", "ID!", "name", "String!", "appearsIn", "[Episode!]!")
                .object("Human", "id", "ID!", "name", "String!", "appearsIn", "[Episode!]!",
                        "homePlanet", "String", "height", "Float")
                .object("Droid", "id", "ID!", "name", "String!", "appearsIn", "[Episode!]!",
                        "primaryFunction", "String")
                .object("Wookiee", "id", "ID!", "name", "String!", "appearsIn", "[Episode!]!")
                .enumType("Episode", "NEWHOPE", "EMPIRE", "JEDI")
                .build();
    }

    /** Wookiee has no inline fragment, so it exercises the catch-all variant. */
    private static Document document() {
        var roster = FieldSelection.of("roster",
                FieldSelection.of("id"),
                FragmentSpread.of("CharacterName"),
                InlineFragment.on("Human", FieldSelection.of("homePlanet"), FieldSelection.of("height")),
                InlineFragment.on("Droid", FieldSelection.of("primaryFunction")));
        var names = new FragmentDefinition("CharacterName", "Character",
                List.of(FieldSelection.of("name"), FieldSelection.of("appearsIn")), null);
        return new Document(List.of(OperationDefinition.query("Roster", roster)), List.of(names));
    }

    private static JsonNode payload(int items, long seed) {
        Random rnd = new Random(seed);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode data = mapper.createObjectNode();
        ArrayNode roster = data.putArray("roster");
        String[] episodes = {"NEWHOPE", "EMPIRE", "JEDI"};

        for (int i = 0; i < items; i++) {
            ObjectNode c = roster.addObject();
            int pick = rnd.nextInt(3);
            String type = pick == 0 ? "Human" : pick == 1 ? "Droid" : "Wookiee";
            c.put("__typename", type);
            c.put("id", type.toLowerCase(Locale.ROOT) + "-" + i);
            c.put("name", "name-" + i);
            ArrayNode appearsIn = c.putArray("appearsIn");
            for (int e = 0; e <= rnd.nextInt(episodes.length); e++) appearsIn.add(episodes[e]);
            if (type.equals("Human")) {
                c.put("homePlanet", rnd.nextBoolean() ? "Tatooine" : null);
                c.put("height", 1.5 + rnd.nextDouble() / 2);
            } else if (type.equals("Droid")) {
                c.put("primaryFunction", "function-" + rnd.nextInt(10));
            }
        }
        return data;
    }

    // ---------- reporting ----------

    private static void summarizeAndPrint(List<Sample> all, long totalOps, int durationSeconds, int items) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / (double) durationSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok) {
                latencies.add(s.latencyMs);
            }
        }
        Collections.sort(latencies);

        double p50 = percentile(latencies, 0.50);
        double p95 = percentile(latencies, 0.95);
        double p99 = percentile(latencies, 0.99);

        long okCount = all.stream().filter(s -> s.ok).count();
        long errCount = all.size() - okCount;

        System.err.printf(
                "throughput=%.2f decodes/s (%.0f items/s), ok=%d, err=%d, p50=%.3fms, p95=%.3fms, p99=%.3fms%n",
                throughput, throughput * items, okCount, errCount, p50, p95, p99
        );

        System.out.println("op,success,latency_ms");
        for (Sample s : all) {
            System.out.printf("DECODE,%s,%.3f%n", s.ok ? "1" : "0", s.latencyMs);
        }
    }

    private static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
