package energysim.metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.DoublePredicate;

/**
 * Поиск событий во временных рядах: первые пересечения, пороги и пики.
 * Все ряды индексируются так же, как массив лет.
 */
public final class SeriesQueries {

    private SeriesQueries() {
    }

    /**
     * Направление пересечения первого ряда относительно второго.
     */
    public enum Direction {
        ABOVE,
        BELOW
    }

    /**
     * Пересечение двух рядов.
     *
     * @param year      год, в котором первый ряд оказался по другую сторону
     * @param direction куда перешёл первый ряд
     * @param first     значение первого ряда в этом году
     * @param second    значение второго ряда в этом году
     */
    public record Crossover(int year, Direction direction, double first, double second) {
    }

    /**
     * Пик ряда.
     */
    public record Peak(int year, double value) {
    }

    /**
     * Первый год, в котором значение удовлетворяет условию.
     */
    public static OptionalInt firstYear(int[] years, double[] series, DoublePredicate condition) {
        checkLengths(years, series);
        for (int i = 0; i < years.length; i++) {
            if (condition.test(series[i])) {
                return OptionalInt.of(years[i]);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Первый год, в котором ряд строго ниже порога.
     */
    public static OptionalInt firstBelow(int[] years, double[] series, double threshold) {
        return firstYear(years, series, v -> v < threshold);
    }

    /**
     * Первое пересечение в любом направлении: состояние в году i отличается от состояния в i−1.
     */
    public static Optional<Crossover> crossover(int[] years, double[] first, double[] second) {
        checkLengths(years, first);
        checkLengths(years, second);
        for (int i = 1; i < years.length; i++) {
            if (first[i] > second[i] && first[i - 1] <= second[i - 1]) {
                return Optional.of(new Crossover(years[i], Direction.ABOVE, first[i], second[i]));
            }
            if (first[i] < second[i] && first[i - 1] >= second[i - 1]) {
                return Optional.of(new Crossover(years[i], Direction.BELOW, first[i], second[i]));
            }
        }
        return Optional.empty();
    }

    /**
     * Первый год, когда первый ряд опустился строго ниже второго
     * (в предыдущем году он был не ниже).
     */
    public static OptionalInt firstCrossBelow(int[] years, double[] first, double[] second) {
        checkLengths(years, first);
        checkLengths(years, second);
        for (int i = 1; i < years.length; i++) {
            if (first[i] < second[i] && first[i - 1] >= second[i - 1]) {
                return OptionalInt.of(years[i]);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Первый год, когда первый ряд поднялся строго выше второго.
     */
    public static OptionalInt firstCrossAbove(int[] years, double[] first, double[] second) {
        return firstCrossBelow(years, second, first);
    }

    /**
     * Пик положительного ряда. Строгое сравнение: при равных значениях остаётся более ранний год.
     * Если все значения не больше нуля, возвращается первый год со значением 0.
     */
    public static Peak peak(int[] years, double[] series) {
        checkLengths(years, series);
        double max = 0.0;
        int idx = 0;
        for (int i = 0; i < series.length; i++) {
            if (series[i] > max) {
                max = series[i];
                idx = i;
            }
        }
        return new Peak(years[idx], max);
    }

    /**
     * Индекс максимума; при равенстве первый.
     */
    public static int argMax(double[] series) {
        if (series.length == 0) {
            throw new IllegalArgumentException("Empty series");
        }
        int idx = 0;
        for (int i = 1; i < series.length; i++) {
            if (series[i] > series[idx]) {
                idx = i;
            }
        }
        return idx;
    }

    /**
     * Поэлементное деление с масштабом; нулевой знаменатель даёт 0.
     */
    public static double[] perCapita(double[] values, double[] population, double scale) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(population, "population");
        if (values.length != population.length) {
            throw new IllegalArgumentException("Series length mismatch: " + values.length + " vs " + population.length);
        }
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = population[i] > 0 ? values[i] * scale / population[i] : 0.0;
        }
        return out;
    }

    /**
     * Поэлементный минимум двух рядов.
     */
    public static double[] min(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Series length mismatch: " + a.length + " vs " + b.length);
        }
        double[] out = new double[a.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.min(a[i], b[i]);
        }
        return out;
    }

    private static void checkLengths(int[] years, double[] series) {
        Objects.requireNonNull(years, "years");
        Objects.requireNonNull(series, "series");
        if (years.length != series.length) {
            throw new IllegalArgumentException("Series length " + series.length + " != years " + years.length);
        }
    }
}
