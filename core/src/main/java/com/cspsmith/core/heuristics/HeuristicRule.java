package com.cspsmith.core.heuristics;

import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ResourceType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 규칙 1개 = (적용 분류, 검사 필드, 패턴 목록, 결과 목록).
 * 패턴은 순서대로 검사하고 첫 매치만 발화한다.
 * 매치된 패턴의 대상(target)마다 결과(outcome)를 하나씩 만들고,
 * (대상, 그룹) 키가 이미 쓰였으면 건너뛴다.
 */
public final class HeuristicRule {

    /** 패턴을 대볼 문자열: 소문자 URL 또는 origin */
    public enum Field { URL, DOMAIN }

    /** 대상 자리표시자: 원본 리소스의 origin */
    public static final String SOURCE_ORIGIN = "$origin";

    /** 패턴 1개 + 매치 시 추론 대상들 */
    public record Entry(String label, Predicate<String> matcher, List<String> targets) {
        public Entry {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(matcher, "matcher");
            targets = List.copyOf(targets);
        }

        public static Entry contains(String pattern) {
            return new Entry(pattern, s -> s.contains(pattern), List.of(SOURCE_ORIGIN));
        }

        public static Entry contains(String pattern, String... targets) {
            return new Entry(pattern, s -> s.contains(pattern), Arrays.asList(targets));
        }

        public static Entry regex(String regex) {
            Pattern p = Pattern.compile(regex);
            return new Entry(regex, s -> p.matcher(s).find(), List.of(SOURCE_ORIGIN));
        }

        public boolean matches(String subject) { return matcher.test(subject); }
    }

    /** 발화 결과. reason 에 %s 가 있으면 매치된 패턴 라벨로 채운다 */
    public record Outcome(InferredType type, Confidence confidence, String group, String reason) {
        public Outcome {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(confidence, "confidence");
            Objects.requireNonNull(group, "group");
            Objects.requireNonNull(reason, "reason");
        }

        String reasonFor(String label) {
            return reason.contains("%s") ? String.format(Locale.ROOT, reason, label) : reason;
        }
    }

    private final String name;
    private final ResourceType appliesTo;   // null → 모든 분류
    private final Field field;
    private final List<Entry> entries;
    private final List<Outcome> outcomes;

    private HeuristicRule(Builder b) {
        this.name = b.name;
        this.appliesTo = b.appliesTo;
        this.field = b.field;
        this.entries = List.copyOf(b.entries);
        this.outcomes = List.copyOf(b.outcomes);
    }

    public String getName() { return name; }
    public ResourceType getAppliesTo() { return appliesTo; }
    public List<Outcome> getOutcomes() { return outcomes; }

    public boolean appliesTo(ResourceType type) {
        return appliesTo == null || appliesTo == type;
    }

    /**
     * 리소스 1건에 대해 평가.
     * @param lowerUrl 소문자 URL
     * @param origin   리소스 origin ("" 이면 origin 대상 추론은 생략)
     */
    void evaluate(ExternalResource resource, String lowerUrl, String origin, InferenceContext ctx) {
        // origin 만 남은 URL(보통 앞선 추론 결과)은 같은 origin 에서 이미 발화한 규칙을 다시 태우지 않는다
        if (isBareOrigin(lowerUrl, origin) && ctx.hasFired(origin, name)) return;

        String subject = (field == Field.URL) ? lowerUrl : origin;
        for (Entry e : entries) {
            if (!e.matches(subject)) continue;
            if (!origin.isEmpty()) ctx.markFired(origin, name);

            for (String t : e.targets()) {
                String target = SOURCE_ORIGIN.equals(t) ? origin : t;
                if (target.isEmpty()) continue;

                for (Outcome o : outcomes) {
                    if (!ctx.claim(InferenceKey.of(target, o.group()))) continue;
                    ctx.emit(HeuristicResource.builder()
                            .url(target)
                            .type(o.type())
                            .confidence(o.confidence())
                            .reason(o.reasonFor(e.label()))
                            .sourceUrl(resource.url())
                            .sourceType(resource.type())
                            .build());
                }
            }
            return; // 첫 매치만
        }
    }

    static boolean isBareOrigin(String lowerUrl, String origin) {
        if (origin.isEmpty()) return false;
        return lowerUrl.equals(origin) || lowerUrl.equals(origin + "/");
    }

    @Override
    public String toString() { return "HeuristicRule{" + name + "}"; }

    public static Builder named(String name) { return new Builder(name); }

    public static final class Builder {
        private final String name;
        private ResourceType appliesTo;
        private Field field = Field.URL;
        private final List<Entry> entries = new ArrayList<>();
        private final List<Outcome> outcomes = new ArrayList<>();

        private Builder(String name) { this.name = Objects.requireNonNull(name, "name"); }

        public Builder on(ResourceType type) { this.appliesTo = type; return this; }
        public Builder onAnyType() { this.appliesTo = null; return this; }

        public Builder matchUrl(Entry... es) { this.field = Field.URL; entries.addAll(Arrays.asList(es)); return this; }
        public Builder matchDomain(Entry... es) { this.field = Field.DOMAIN; entries.addAll(Arrays.asList(es)); return this; }

        public Builder infer(InferredType type, Confidence confidence, String group, String reason) {
            outcomes.add(new Outcome(type, confidence, group, reason));
            return this;
        }

        public HeuristicRule build() {
            if (entries.isEmpty()) throw new IllegalStateException("rule '" + name + "' has no patterns");
            if (outcomes.isEmpty()) throw new IllegalStateException("rule '" + name + "' has no outcomes");
            return new HeuristicRule(this);
        }
    }
}
