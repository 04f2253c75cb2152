package com.stackprobe.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** URL 목록 파일 파서: '#' 주석 줄과 빈 줄은 건너뛰고 앞뒤 공백 제거 */
public final class UrlListReader {
    private UrlListReader() {}

    public static List<String> read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) throw new IOException("URL file not found: " + file);
        List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String s = line.strip();
            if (s.isEmpty() || s.startsWith("#")) continue;
            out.add(s);
        }
        return out;
    }
}
