package com.lux032.trackresolver.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 文本相似度工具
 * 各平台的置信度阈值都是按这里的公式调出来的,所有适配器必须共用这一实现
 */
public final class TextSimilarity {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
    }

    /**
     * 规范化: 去掉变音符号、转小写、标点替换为空格、合并空白
     * "Beyoncé - Halo!" -> "beyonce halo"
     */
    public static String normalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String spaced = PUNCTUATION.matcher(stripped).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 非对称词重叠度 |A∩B| / max(|A|,|B|)
     * 比 Jaccard 更宽容,一方是另一方超集时(如带 "feat. X" 后缀)分数不会被压得太低
     * @return [0,1],任一方没有词时返回 0
     */
    public static double similarity(String a, String b) {
        Set<String> tokensA = tokenize(a);
        Set<String> tokensB = tokenize(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : tokensA) {
            if (tokensB.contains(token)) {
                intersection++;
            }
        }
        return (double) intersection / Math.max(tokensA.size(), tokensB.size());
    }

    static Set<String> tokenize(String s) {
        String normalized = normalize(s);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
