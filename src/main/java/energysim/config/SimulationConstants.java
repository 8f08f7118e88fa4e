package energysim.config;

/**
 * Общие константы модели, не зависящие от сценария.
 */
public final class SimulationConstants {

    // ===================== ГОРИЗОНТ МОДЕЛИРОВАНИЯ =====================

    /**
     * Первый моделируемый год (базовый, i = 0).
     */
    public static final int START_YEAR = 2025;

    /**
     * Последний моделируемый год (включительно).
     */
    public static final int END_YEAR = 2100;

    /**
     * Количество моделируемых лет.
     */
    public static final int YEAR_COUNT = END_YEAR - START_YEAR + 1;

    // ===================== ЕДИНИЦЫ =====================

    /**
     * Число часов в году.
     */
    public static final double HOURS_PER_YEAR = 8760.0;

    /**
     * Число дней в году.
     */
    public static final double DAYS_PER_YEAR = 365.0;

    /**
     * TWh·(kg/MWh) -> Gt CO2.
     */
    public static final double KG_TWH_TO_GT = 1e6;

    /**
     * $ trillions.
     */
    public static final double TRILLION = 1e12;

    /**
     * Порог "нулевых" знаменателей в удельных показателях.
     */
    public static final double EPSILON = 1e-6;

    private SimulationConstants() {
    }

    /**
     * Индекс года в рядах (year - 2025).
     */
    public static int yearIndex(int year) {
        return year - START_YEAR;
    }

    public static int yearAt(int index) {
        return START_YEAR + index;
    }

    /**
     * Массив лет 2025..2100.
     */
    public static int[] years() {
        int[] years = new int[YEAR_COUNT];
        for (int i = 0; i < YEAR_COUNT; i++) {
            years[i] = START_YEAR + i;
        }
        return years;
    }
}
