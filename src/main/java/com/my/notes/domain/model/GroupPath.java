package com.my.notes.domain.model;

import com.my.notes.domain.exception.InvalidGroupPathException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 논리 그룹 경로를 문자열 대신 값 객체로 다뤄 기본 그룹 식별과 조상/자손 판정을 한 곳에서 보장하기 위함.
 * <p>
 * 기본 그룹은 화면 표시용 문구가 아니라 {@link #DEFAULT_NAME} 센티널로만 식별한다.
 */
public record GroupPath(List<String> segments) {

    public static final String DEFAULT_NAME = "default";
    public static final String SEPARATOR = "/";

    public static final GroupPath DEFAULT = new GroupPath(List.of());

    public GroupPath {
        Objects.requireNonNull(segments, "segments");
        segments = List.copyOf(segments);
        for (String segment : segments) {
            requireDirectoryName(segment, segment);
        }
    }

    /**
     * 호출자가 넘긴 "Work/Notes" 형태의 경로를 해석한다. null, 빈 문자열, "default"는 기본 그룹이다.
     * 공백뿐인 세그먼트와 역슬래시는 여기서만 거부한다.
     */
    public static GroupPath parse(String raw) {
        if (raw == null || raw.isEmpty() || DEFAULT_NAME.equals(raw)) {
            return DEFAULT;
        }
        if (raw.startsWith(SEPARATOR) || raw.startsWith("\\")) {
            throw new InvalidGroupPathException(raw, "절대 경로는 그룹 경로로 쓸 수 없습니다");
        }
        String[] parts = raw.split(SEPARATOR, -1);
        List<String> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            requireDirectoryName(raw, part);
            if (part.isBlank()) {
                throw new InvalidGroupPathException(raw, "빈 그룹 이름이 포함되어 있습니다");
            }
            if (part.contains("\\")) {
                throw new InvalidGroupPathException(raw, "그룹 이름에 사용할 수 없는 문자가 있습니다");
            }
            segments.add(part);
        }
        return new GroupPath(segments);
    }

    /**
     * 디스크에서 읽은 이름에도 적용되는 최소 조건. 호스트가 허용하는 이름(공백, ':' 포함)은 통과시킨다.
     */
    private static void requireDirectoryName(String raw, String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new InvalidGroupPathException(raw, "빈 그룹 이름이 포함되어 있습니다");
        }
        if (".".equals(segment) || "..".equals(segment)) {
            throw new InvalidGroupPathException(raw, "상위 디렉터리 이동은 허용되지 않습니다");
        }
        if (segment.contains(SEPARATOR) || segment.indexOf('\0') >= 0) {
            throw new InvalidGroupPathException(raw, "그룹 이름에 사용할 수 없는 문자가 있습니다");
        }
    }

    /**
     * 숨김 이름('.' 으로 시작)인 세그먼트가 있으면 true.
     */
    public boolean isHidden() {
        return segments.stream().anyMatch(segment -> segment.startsWith("."));
    }

    public boolean isDefault() {
        return segments.isEmpty();
    }

    /**
     * 마지막 세그먼트. 기본 그룹이면 "default".
     */
    public String leaf() {
        return isDefault() ? DEFAULT_NAME : segments.get(segments.size() - 1);
    }

    /**
     * 부모 그룹. 최상위 그룹의 부모는 기본 그룹이고, 기본 그룹은 부모가 없다.
     */
    public Optional<GroupPath> parent() {
        if (isDefault()) {
            return Optional.empty();
        }
        return Optional.of(new GroupPath(segments.subList(0, segments.size() - 1)));
    }

    public GroupPath child(String name) {
        List<String> extended = new ArrayList<>(segments);
        extended.add(name);
        return new GroupPath(extended);
    }

    /**
     * 기본 그룹을 제외한 모든 조상 그룹을 얕은 것부터 돌려준다. 자기 자신은 포함하지 않는다.
     */
    public List<GroupPath> ancestors() {
        List<GroupPath> ancestors = new ArrayList<>();
        for (int i = 1; i < segments.size(); i++) {
            ancestors.add(new GroupPath(segments.subList(0, i)));
        }
        return ancestors;
    }

    public int depth() {
        return segments.size();
    }

    /**
     * 논리 경로 문자열 기준 접두사 판정: 같은 경로이거나 other + "/" 로 시작하면 true.
     */
    public boolean isSameOrDescendantOf(GroupPath other) {
        String self = value();
        String candidate = other.value();
        return self.equals(candidate) || (!other.isDefault() && self.startsWith(candidate + SEPARATOR));
    }

    public String value() {
        return isDefault() ? DEFAULT_NAME : String.join(SEPARATOR, segments);
    }

    @Override
    public String toString() {
        return value();
    }
}
