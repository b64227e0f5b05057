package dumb.logics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.logics.deduction.NaturalDeduction;
import dumb.logics.deduction.Proof;
import dumb.logics.parse.Parser;
import dumb.logics.semantics.Evaluator;
import dumb.logics.semantics.Interpretation;
import dumb.logics.util.Json;
import dumb.logics.util.Printer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry points over the shared formula factory {@link Formulas#the}.
 */
public final class Logics {

    private static final Logger logger = LoggerFactory.getLogger(Logics.class);

    public static final String CONFIG_RESOURCE = "logics.json";

    private static volatile Configuration configuration;

    private Logics() {
    }

    public static Formula parsePl(String text) throws Parser.ParseException {
        return Parser.parsePl(text);
    }

    public static Formula parseLtl(String text) throws Parser.ParseException {
        return Parser.parseLtl(text);
    }

    public static Formula parsePltl(String text) throws Parser.ParseException {
        return Parser.parsePltl(text);
    }

    public static Formula parseLdl(String text) throws Parser.ParseException {
        return Parser.parseLdl(text);
    }

    public static Formula parseFol(String text) throws Parser.ParseException {
        return Parser.parseFol(text);
    }

    public static String toString(Formula f) {
        return Printer.toString(f);
    }

    public static boolean evaluate(Formula f, Set<String> trueAtoms) {
        return Evaluator.evaluate(f, Interpretation.of(trueAtoms));
    }

    public static boolean evaluate(Formula f, Map<String, Boolean> interpretation) {
        return Evaluator.evaluate(f, Interpretation.of(interpretation));
    }

    public static Proof buildProof(List<?> rows) {
        return Proof.build(rows);
    }

    public static boolean checkProof(Proof proof) {
        return new NaturalDeduction(Formulas.the, configuration()).check(proof);
    }

    public static void resetCache() {
        Formulas.resetCache();
    }

    public static Map<Formalism, Set<Formula>> getCacheContext() {
        return Formulas.cacheContext();
    }

    public static Configuration configuration() {
        var c = configuration;
        if (c == null) {
            synchronized (Logics.class) {
                c = configuration;
                if (c == null) configuration = c = load(CONFIG_RESOURCE);
            }
        }
        return c;
    }

    public static void configure(Configuration c) {
        configuration = c;
        logger.info("configuration set: {}", c);
    }

    /**
     * Reads a configuration from a classpath resource; defaults apply when it is absent or unreadable.
     */
    static Configuration load(String resource) {
        try (var in = Logics.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("{} not found, using default configuration", resource);
                return new Configuration();
            }
            var c = Json.obj(in, Configuration.class);
            logger.debug("configuration loaded from {}: {}", resource, c);
            return c;
        } catch (IOException e) {
            logger.warn("Could not read {}, using default configuration: {}", resource, e.getMessage());
            return new Configuration();
        }
    }

    /**
     * @param maxProofDepth       deepest box nesting the proof checker accepts
     * @param materialImplication whether {@code ~a | b} also counts as {@code a -> b} when checking proofs
     * @param traceProofs         log every checked proof row
     */
    public record Configuration(
            @JsonProperty("maxProofDepth") int maxProofDepth,
            @JsonProperty("materialImplication") boolean materialImplication,
            @JsonProperty("traceProofs") boolean traceProofs
    ) {
        public static final int DEFAULT_MAX_PROOF_DEPTH = 64;
        public static final boolean DEFAULT_MATERIAL_IMPLICATION = true;
        public static final boolean DEFAULT_TRACE_PROOFS = false;

        @JsonCreator
        public Configuration(
                @JsonProperty("maxProofDepth") Integer maxProofDepth,
                @JsonProperty("materialImplication") Boolean materialImplication,
                @JsonProperty("traceProofs") Boolean traceProofs
        ) {
            this(
                    maxProofDepth != null ? maxProofDepth : DEFAULT_MAX_PROOF_DEPTH,
                    materialImplication != null ? materialImplication : DEFAULT_MATERIAL_IMPLICATION,
                    traceProofs != null ? traceProofs : DEFAULT_TRACE_PROOFS
            );
        }

        public Configuration() {
            this(DEFAULT_MAX_PROOF_DEPTH, DEFAULT_MATERIAL_IMPLICATION, DEFAULT_TRACE_PROOFS);
        }
    }
}
