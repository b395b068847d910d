package io.simpledb.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Json helpers for the shell's config files. Not meant for the query hot path.
 */
public class JsonUtil {
    private static final Pattern ExtendFlag = Pattern.compile("\"@extend:.*?\"");
    public static final ObjectMapper jsonMapper = new ObjectMapper();
    public static final ObjectMapper jsonMapperPretty = new ObjectMapper();

    static {
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        jsonMapper.configure(SerializationFeature.INDENT_OUTPUT, false);

        jsonMapperPretty.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public static String toJsonPretty(Object v) {
        try {
            return jsonMapperPretty.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Loads a json config file. A string value of the form {@code "@extend:other.json"} is replaced
     * by the content of that file, resolved against the directory of the including file.
     */
    public static <T> T loadConfig(Path path, Class<T> clazz) throws IOException {
        return jsonMapper.readValue(readJsonFile(path), clazz);
    }

    private static String readJsonFile(Path path) throws IOException {
        File configFile = path.toFile();
        if (!configFile.isFile() || !configFile.canRead()) {
            throw new IOException(String.format("json file [%s] invalid!", path));
        }
        String content;
        try (FileInputStream is = new FileInputStream(configFile)) {
            content = IOUtils.toString(is, StandardCharsets.UTF_8);
        }

        Matcher matcher = ExtendFlag.matcher(content);
        StringBuffer json = new StringBuffer();
        while (matcher.find()) {
            String included = StringUtils.removeStart(StringUtils.strip(matcher.group(), "\"").trim(), "@extend:").trim();
            Path includedPath = path.toAbsolutePath().getParent().resolve(included);
            matcher.appendReplacement(json, Matcher.quoteReplacement(readJsonFile(includedPath)));
        }
        matcher.appendTail(json);
        return json.toString();
    }
}
