package io.github.manjago.evoformula.engine;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;
import io.github.manjago.evoformula.fitness.Domain;
import io.github.manjago.evoformula.fitness.FitnessFunctions;
import io.github.manjago.evoformula.genetic.ExpressionBreeder;
import io.github.manjago.evoformula.genetic.TreeSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionTest {

    private static final Domain DOMAIN = new Domain(0, 1, 0.1);

    /**
     * Integer candidates: mutation halves, crossover returns the first parent,
     * fresh instances count upwards. Score is the value itself.
     */
    static class HalvingBreeder implements Breeder<Integer> {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Integer newInstance(SearchRng rng) {
            return counter.incrementAndGet();
        }

        @Override
        public Integer mutate(Integer candidate, SearchRng rng) {
            return candidate / 2;
        }

        @Override
        public Integer cross(Integer first, Integer second, SearchRng rng) {
            return first;
        }

        @Override
        public double score(Integer candidate) {
            return candidate;
        }
    }

    /** Produces the same candidate no matter what. */
    static class ConstantBreeder implements Breeder<String> {
        @Override public String newInstance(SearchRng rng) { return "a"; }
        @Override public String mutate(String candidate, SearchRng rng) { return candidate; }
        @Override public String cross(String first, String second, SearchRng rng) { return first; }
        @Override public double score(String candidate) { return 0; }
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Seeded candidate with score 0 stays best after one epoch")
        void seededCandidate() throws Exception {
            Expression seed = new ExpressionParser().parse("x * x + 1.0");
            ExpressionBreeder breeder = new ExpressionBreeder(TreeSettings.defaults(),
                    candidate -> candidate.equals(seed) ? 0 : 1);
            EvolutionSettings settings = EvolutionSettings.of(20, Objective.MINIMIZE).withThreads(2);

            try (Evolution<Expression> evolution = new Evolution<>(breeder, settings, new SearchRng(1))) {
                evolution.initialize(seed);
                evolution.train(1);

                assertEquals(1, evolution.getEpoch());
                assertEquals(20, evolution.population().size());
                assertEquals(seed, evolution.best().candidate());
                assertEquals(0.0, evolution.best().score(), 0);
            }
        }

        @Test
        @DisplayName("Population size is exact after every epoch of a 100-epoch run")
        void sizeInvariant() throws Exception {
            Expression target = new ExpressionParser().parse("x ^ 2.0 + sin(x)");
            ExpressionBreeder breeder = new ExpressionBreeder(TreeSettings.defaults(),
                    FitnessFunctions.MSE.against(target, DOMAIN, "x"));
            EvolutionSettings settings = EvolutionSettings.of(50, Objective.MINIMIZE).withThreads(2);

            List<EpochStats> history = new ArrayList<>();
            List<Double> bestScores = new ArrayList<>();

            try (Evolution<Expression> evolution = new Evolution<>(breeder, settings, new SearchRng(2))) {
                evolution.setListener(new EvolutionListener<>() {
                    @Override
                    public void onEpoch(EpochStats stats, Scored<Expression> best) {
                        List<Scored<Expression>> population = evolution.population();
                        assertEquals(50, population.size());
                        assertEquals(50, new HashSet<>(population.stream().map(Scored::candidate).toList()).size());
                        assertSame(population.get(0), best);
                        history.add(stats);
                        bestScores.add(best.score());
                    }
                });
                evolution.train(100);
            }

            assertEquals(100, history.size());
            for (int i = 1; i < bestScores.size(); i++) {
                assertTrue(bestScores.get(i) <= bestScores.get(i - 1), "best score got worse at epoch " + (i + 1));
            }
            assertEquals(100, history.get(99).epoch());
        }

        @Test
        @DisplayName("Maximising keeps the highest score first")
        void maximize() {
            HalvingBreeder breeder = new HalvingBreeder();
            EvolutionSettings settings = new EvolutionSettings(10, 2, 2, 5, 1000, 1, Objective.MAXIMIZE, 10);
            try (Evolution<Integer> evolution = new Evolution<>(breeder, settings, new SearchRng(3))) {
                evolution.train(5);
                List<Scored<Integer>> population = evolution.population();
                for (int i = 1; i < population.size(); i++) {
                    assertTrue(population.get(i - 1).score() >= population.get(i).score());
                }
            }
        }
    }

    @Nested
    @DisplayName("Deduplication and backfill")
    class Backfill {

        @Test
        @DisplayName("Near-equal candidates collapse to the first occurrence")
        void deduplicateNearEqual() {
            Expression x = new Variable("x");
            Scored<Expression> first = new Scored<>(new BinaryOp(BinaryKind.ADD, x, new Const(1.0)), 5);
            Scored<Expression> second = new Scored<>(new BinaryOp(BinaryKind.ADD, x, new Const(1.0 + 1e-9)), 3);
            Scored<Expression> other = new Scored<>(new BinaryOp(BinaryKind.ADD, x, new Const(2.0)), 4);

            List<Scored<Expression>> unique = Evolution.deduplicate(List.of(first, second, other));
            assertEquals(List.of(first, other), unique);
        }

        @Test
        @DisplayName("Backfill tops up a pool with too few distinct candidates")
        void backfillRestoresSize() {
            EvolutionSettings settings = new EvolutionSettings(10, 2, 0, 2, 1000, 1, Objective.MINIMIZE, 10);
            try (Evolution<Integer> evolution = new Evolution<>(new HalvingBreeder(), settings, new SearchRng(4))) {
                evolution.initialize(null);
                EpochStats stats = evolution.runEpoch();

                assertTrue(stats.backfilled() > 0, stats.toString());
                assertEquals(10, evolution.population().size());
                assertEquals(10, new HashSet<>(evolution.population()).size());
            }
        }

        @Test
        @DisplayName("Breeder without diversity aborts the run")
        void collapse() {
            EvolutionSettings settings = new EvolutionSettings(5, 1, 1, 1, 3, 1, Objective.MINIMIZE, 10);
            try (Evolution<String> evolution = new Evolution<>(new ConstantBreeder(), settings, new SearchRng(5))) {
                PopulationCollapseException e = assertThrows(PopulationCollapseException.class,
                        () -> evolution.train(1));
                assertEquals(5, e.getRequired());
                assertEquals(1, e.getAvailable());
                assertFalse(evolution.isRunning());
            }
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Best before initialisation is an error")
        void bestBeforeInit() {
            EvolutionSettings settings = new EvolutionSettings(5, 1, 1, 1, 10, 1, Objective.MINIMIZE, 10);
            try (Evolution<Integer> evolution = new Evolution<>(new HalvingBreeder(), settings, new SearchRng(6))) {
                assertThrows(IllegalStateException.class, evolution::best);
                assertTrue(evolution.population().isEmpty());
            }
        }

        @Test
        @DisplayName("Stop requested from the listener ends training after the current epoch")
        void stopFromListener() {
            EvolutionSettings settings = new EvolutionSettings(10, 2, 2, 5, 1000, 1, Objective.MINIMIZE, 10);
            try (Evolution<Integer> evolution = new Evolution<>(new HalvingBreeder(), settings, new SearchRng(7))) {
                AtomicInteger finishedEpochs = new AtomicInteger(-1);
                evolution.setListener(new EvolutionListener<>() {
                    @Override
                    public void onEpoch(EpochStats stats, Scored<Integer> best) {
                        if (stats.epoch() == 3) {
                            evolution.stop();
                        }
                    }

                    @Override
                    public void onFinish(Scored<Integer> best, int epochs) {
                        finishedEpochs.set(epochs);
                    }
                });
                evolution.train(50);

                assertEquals(3, evolution.getEpoch());
                assertEquals(3, finishedEpochs.get());
            }
        }

        @Test
        @DisplayName("Initial population holds the seed")
        void initialPopulation() {
            EvolutionSettings settings = new EvolutionSettings(8, 2, 2, 5, 1000, 1, Objective.MAXIMIZE, 10);
            try (Evolution<Integer> evolution = new Evolution<>(new HalvingBreeder(), settings, new SearchRng(8))) {
                evolution.initialize(1_000_000);
                assertEquals(8, evolution.population().size());
                assertEquals(1_000_000, evolution.best().candidate());
            }
        }
    }
}
