package energysim.io;

/**
 * Ошибка чтения или проверки файла сценария.
 * Бросается до запуска первого года моделирования.
 */
public class ScenarioLoadException extends Exception {

    public ScenarioLoadException(String message) {
        super(message);
    }

    public ScenarioLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
