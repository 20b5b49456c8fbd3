package com.my.notes.domain.model;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 파일 내용을 헤더 블록과 본문으로 나눠 읽고 같은 형식으로 다시 쓰기 위함.
 * <pre>
 * ---
 * title: 제목
 * id: 1700000000000
 * date: 2026-01-13T01:02:03+09:00
 * ---
 *
 * 본문
 * </pre>
 * 헤더가 없거나 title/id 가 빠진 파일은 내용 전체를 본문으로 본다.
 */
public record NoteDocument(NoteHeader header, String body) {

    private static final String FENCE = "---";

    public NoteDocument {
        Objects.requireNonNull(body, "body");
    }

    public static NoteDocument plain(String body) {
        return new NoteDocument(null, body);
    }

    public Optional<NoteHeader> headerIfPresent() {
        return Optional.ofNullable(header);
    }

    public static NoteDocument parse(String content) {
        Objects.requireNonNull(content, "content");
        String normalized = content.startsWith("\uFEFF") ? content.substring(1) : content;
        if (!normalized.startsWith(FENCE)) {
            return plain(content);
        }
        int firstBreak = normalized.indexOf('\n');
        if (firstBreak < 0 || !normalized.substring(0, firstBreak).strip().equals(FENCE)) {
            return plain(content);
        }

        String title = null;
        String id = null;
        OffsetDateTime date = null;
        int cursor = firstBreak + 1;
        int closingEnd = -1;
        while (cursor <= normalized.length()) {
            int lineEnd = normalized.indexOf('\n', cursor);
            String line = lineEnd < 0 ? normalized.substring(cursor) : normalized.substring(cursor, lineEnd);
            String trimmed = line.strip();
            if (trimmed.equals(FENCE)) {
                closingEnd = lineEnd < 0 ? normalized.length() : lineEnd + 1;
                break;
            }
            int colon = trimmed.indexOf(':');
            if (colon > 0) {
                String key = trimmed.substring(0, colon).strip();
                String value = trimmed.substring(colon + 1).strip();
                switch (key) {
                    case "title" -> title = value;
                    case "id" -> id = value;
                    case "date" -> date = parseDate(value);
                    default -> {
                        // 알 수 없는 키는 무시한다.
                    }
                }
            }
            if (lineEnd < 0) {
                break;
            }
            cursor = lineEnd + 1;
        }
        if (closingEnd < 0 || title == null || id == null) {
            return plain(content);
        }
        String body = stripLeadingLineBreaks(normalized.substring(closingEnd));
        return new NoteDocument(new NoteHeader(title, id, date), body);
    }

    public String render() {
        if (header == null) {
            return body;
        }
        StringBuilder out = new StringBuilder();
        out.append(FENCE).append('\n')
                .append("title: ").append(header.title()).append('\n')
                .append("id: ").append(header.id()).append('\n');
        if (header.date() != null) {
            out.append("date: ").append(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(header.date())).append('\n');
        }
        out.append(FENCE).append("\n\n").append(body);
        return out.toString();
    }

    private static OffsetDateTime parseDate(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripLeadingLineBreaks(String text) {
        int start = 0;
        while (start < text.length() && (text.charAt(start) == '\n' || text.charAt(start) == '\r')) {
            start++;
        }
        return text.substring(start);
    }
}
