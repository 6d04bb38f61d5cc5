package com.lux032.yearresolver.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Loads {@code messages_<language>.properties} from the classpath and resolves message keys.
 */
@Slf4j
public class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static Properties messages;
    private static String currentLanguage = DEFAULT_LANGUAGE;

    private I18nUtil() {
    }

    /**
     * @param language language code such as en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        currentLanguage = language;
        Properties loaded = new Properties();
        String resourceFile = "/messages_" + language + ".properties";

        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.error("i18n resource file not found: {}", resourceFile);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
                return;
            }
            messages = loaded;
            return;
        }

        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
            log.debug("Loaded i18n resource file: {}", resourceFile);
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
        }
        messages = loaded;
    }

    /**
     * @return the message for the key, or the key itself when missing
     */
    public static String getMessage(String key) {
        return messages().getProperty(key, key);
    }

    /**
     * Resolve a message and substitute SLF4J style {@code {}} placeholders.
     */
    public static String getMessage(String key, Object... args) {
        String pattern = messages().getProperty(key, key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return formatMessage(pattern, args);
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }

    private static synchronized Properties messages() {
        if (messages == null) {
            init(currentLanguage);
        }
        return messages;
    }

    private static String formatMessage(String pattern, Object... args) {
        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        int i = 0;

        while (i < pattern.length()) {
            if (i < pattern.length() - 1 && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    result.append(args[argIndex] != null ? args[argIndex].toString() : "null");
                    argIndex++;
                } else {
                    result.append("{}");
                }
                i += 2;
            } else {
                result.append(pattern.charAt(i));
                i++;
            }
        }

        return result.toString();
    }
}
