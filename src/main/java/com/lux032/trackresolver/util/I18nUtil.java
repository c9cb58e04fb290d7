package com.lux032.trackresolver.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 国际化工具类
 * 失败原因、替换进度等面向用户的文本都从这里取
 */
@Slf4j
public final class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static volatile Properties messages;
    private static volatile String currentLanguage = DEFAULT_LANGUAGE;

    private I18nUtil() {
    }

    /**
     * 初始化国际化资源
     * @param language 语言代码,如 zh_CN 或 en_US;找不到对应资源时回退到英文
     */
    public static synchronized void init(String language) {
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
        Properties loaded = load(language);
        if (loaded == null && !DEFAULT_LANGUAGE.equals(language)) {
            log.warn("Missing i18n resource for {}, falling back to {}", language, DEFAULT_LANGUAGE);
            language = DEFAULT_LANGUAGE;
            loaded = load(language);
        }
        currentLanguage = language;
        messages = loaded != null ? loaded : new Properties();
    }

    private static Properties load(String language) {
        String resourceFile = "/messages_" + language + ".properties";
        try (InputStream is = I18nUtil.class.getResourceAsStream(resourceFile)) {
            if (is == null) {
                return null;
            }
            Properties props = new Properties();
            props.load(new InputStreamReader(is, StandardCharsets.UTF_8));
            log.debug("Loaded i18n resource file: {}", resourceFile);
            return props;
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
            return null;
        }
    }

    /**
     * 获取消息并替换 SLF4J 风格的 {} 占位符,找不到键时返回键本身
     */
    public static String getMessage(String key, Object... args) {
        if (messages == null) {
            init(currentLanguage);
        }
        String pattern = messages.getProperty(key, key);
        return format(pattern, args);
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }

    static String format(String pattern, Object... args) {
        if (args == null || args.length == 0) {
            return pattern;
        }
        StringBuilder result = new StringBuilder(pattern.length() + 16 * args.length);
        int argIndex = 0;
        int i = 0;
        while (i < pattern.length()) {
            if (i + 1 < pattern.length() && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}'
                    && argIndex < args.length) {
                result.append(args[argIndex++]);
                i += 2;
            } else {
                result.append(pattern.charAt(i++));
            }
        }
        return result.toString();
    }
}
