package ru.aritmos.presencegateway.core;

/**
 * Санитайзер чувствительных данных для логов.
 * <p>
 * Назначение: не допустить попадания в лог подписи handshake, секретов и Bearer-токенов,
 * которые могут оказаться в тексте ошибок транспорта или разбора кадров.
 * <p>
 * Важно: санитайзер работает эвристически. Payload событий в лог не выводится вообще.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Маска для скрытия чувствительных значений.
     */
    private static final String MASK = "***";

    /**
     * Ограничение длины диагностической строки, чтобы фрагмент кадра не «раздувал» лог.
     */
    private static final int MAX_LENGTH = 300;

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     * <p>
     * Эвристика:
     * <ul>
     *   <li>маскируем Bearer-токены;</li>
     *   <li>маскируем {@code token/secret} в формате key=value и в JSON-фрагментах;</li>
     *   <li>убираем переводы строк и обрезаем слишком длинный текст.</li>
     * </ul>
     *
     * @param text исходный текст
     * @return санитизированный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;

        // Bearer <token>
        t = t.replaceAll("(?i)bearer\\s+[^\\s]+", "Bearer " + MASK);

        // Параметры формата key=value
        t = t.replaceAll("(?i)(token|secret|access_token|refresh_token)\\s*=\\s*[^\\s&]+", "$1=" + MASK);

        // JSON-фрагменты вида "token":"..."
        t = t.replaceAll("(?i)\"(token|secret)\"\\s*:\\s*\"[^\"]*\"", "\"$1\":\"" + MASK + "\"");

        // Избегаем многострочности в сообщениях.
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        if (t.length() > MAX_LENGTH) {
            t = t.substring(0, MAX_LENGTH) + "...";
        }
        return t;
    }
}
