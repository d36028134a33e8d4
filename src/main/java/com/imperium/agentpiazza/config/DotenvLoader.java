package com.imperium.agentpiazza.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前读取工作目录下的 .env，把 KEY=VALUE 写成系统属性。
 * 已存在的环境变量或系统属性优先，不会被 .env 覆盖。
 * 此时日志系统尚未初始化，因此直接写标准输出。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*)$");

    /** Spring AI 会自行拼接 /v1，这些 base url 需要去掉结尾的 /v1 */
    private static final Set<String> OPENAI_BASE_URL_KEYS = Set.of("OPENAI_BASE_URL", "OPENAI_EMBEDDING_BASE_URL");

    private DotenvLoader() {
    }

    public static void load() {
        Path envPath = Paths.get(System.getProperty("user.dir")).resolve(".env");
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] no .env at " + envPath + ", using environment only");
            return;
        }
        Map<String, String> entries;
        try {
            entries = parse(Files.readString(envPath));
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to read .env: " + e.getMessage());
            return;
        }
        entries.forEach((key, value) -> {
            if (System.getenv(key) != null || System.getProperty(key) != null) {
                return;
            }
            System.setProperty(key, value);
            System.out.println("[DotenvLoader] " + key + " = " + (isSecret(key) ? "***" : value));
        });
    }

    /**
     * 解析 .env 文本；忽略空行与 # 注释行，去掉成对引号。
     */
    public static Map<String, String> parse(String content) {
        Map<String, String> out = new LinkedHashMap<>();
        if (content == null) {
            return out;
        }
        for (String line : content.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher m = ENV_LINE.matcher(trimmed);
            if (!m.matches()) {
                continue;
            }
            String key = m.group(1);
            String value = unquote(m.group(2).trim());
            if (OPENAI_BASE_URL_KEYS.contains(key)) {
                value = stripVersionSuffix(value);
            }
            out.put(key, value);
        }
        return out;
    }

    static String stripVersionSuffix(String url) {
        String v = url.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        return v;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("PASSWORD") || key.contains("SECRET");
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }
}
