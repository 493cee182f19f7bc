package ru.aritmos.presencegateway.core;

/**
 * Ошибка разбора входящего кадра.
 * <p>
 * Исключение проверяемое: вызывающий код обязан решить, что делать с битым кадром.
 * Правило по умолчанию - залогировать и продолжить обслуживать соединение.
 */
public class EnvelopeDecodeException extends Exception {

    private final String code;

    public EnvelopeDecodeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EnvelopeDecodeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return короткий код причины (MALFORMED_JSON, MISSING_TYPE, MISSING_USER_ID и т.п.)
     */
    public String code() {
        return code;
    }
}
