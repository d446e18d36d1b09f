package com.flamingo.ai.docstructure.service.grouping;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping from functional group name to the lowercase keywords that select it.
 *
 * <p>Instances are immutable: every modifier returns a fresh taxonomy. Keywords are lowercased with
 * {@link Locale#ROOT}, blank keywords are dropped and duplicates collapse while keeping first
 * insertion order.
 */
public final class KeywordTaxonomy {

  /** Built-in taxonomy for Korean functional specifications. */
  public static final KeywordTaxonomy DEFAULT = createDefault();

  private final Map<String, Set<String>> keywords;

  private KeywordTaxonomy(Map<String, ? extends Collection<String>> source) {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    source.forEach((name, kws) -> copy.put(name, normalize(kws)));
    this.keywords = Collections.unmodifiableMap(copy);
  }

  public static KeywordTaxonomy of(Map<String, ? extends Collection<String>> groups) {
    return new KeywordTaxonomy(groups);
  }

  public static KeywordTaxonomy empty() {
    return new KeywordTaxonomy(Map.of());
  }

  /**
   * Returns a taxonomy with {@code custom} merged in. Keywords for an existing group are appended;
   * new groups are added after the existing ones in the iteration order of {@code custom}.
   */
  public KeywordTaxonomy merge(Map<String, ? extends Collection<String>> custom) {
    if (custom == null || custom.isEmpty()) {
      return this;
    }
    Map<String, Set<String>> merged = mutableCopy();
    custom.forEach(
        (name, kws) -> {
          Set<String> target = merged.computeIfAbsent(name, k -> new LinkedHashSet<>());
          if (kws != null) {
            target.addAll(kws);
          }
        });
    return new KeywordTaxonomy(merged);
  }

  /** Returns a taxonomy where {@code name} additionally selects on {@code groupKeywords}. */
  public KeywordTaxonomy withGroup(String name, Collection<String> groupKeywords) {
    return merge(Map.of(name, groupKeywords));
  }

  /** Returns a taxonomy without {@code name}; unchanged if the group is unknown. */
  public KeywordTaxonomy withoutGroup(String name) {
    if (!keywords.containsKey(name)) {
      return this;
    }
    Map<String, Set<String>> copy = mutableCopy();
    copy.remove(name);
    return new KeywordTaxonomy(copy);
  }

  /** Keywords for {@code name}, or an empty set for an unknown group. */
  public Set<String> keywordsFor(String name) {
    return keywords.getOrDefault(name, Set.of());
  }

  public List<String> groupNames() {
    return List.copyOf(keywords.keySet());
  }

  public boolean contains(String name) {
    return keywords.containsKey(name);
  }

  public int size() {
    return keywords.size();
  }

  /** Unmodifiable view in group order. */
  public Map<String, Set<String>> asMap() {
    return keywords;
  }

  private Map<String, Set<String>> mutableCopy() {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    keywords.forEach((name, kws) -> copy.put(name, new LinkedHashSet<>(kws)));
    return copy;
  }

  private static Set<String> normalize(Collection<String> kws) {
    Set<String> normalized = new LinkedHashSet<>();
    if (kws != null) {
      for (String kw : kws) {
        if (kw != null && !kw.isBlank()) {
          normalized.add(kw.strip().toLowerCase(Locale.ROOT));
        }
      }
    }
    return Collections.unmodifiableSet(normalized);
  }

  private static KeywordTaxonomy createDefault() {
    Map<String, List<String>> groups = new LinkedHashMap<>();
    groups.put(
        "인증",
        List.of(
            "로그인", "로그아웃", "회원가입", "탈퇴", "비밀번호", "인증", "권한", "세션", "토큰", "OAuth",
            "SSO"));
    groups.put(
        "결제", List.of("결제", "구매", "주문", "카드", "환불", "정산", "포인트", "쿠폰", "할인", "가격"));
    groups.put("사용자관리", List.of("사용자", "회원", "프로필", "개인정보", "계정", "정보수정", "마이페이지"));
    groups.put("상품관리", List.of("상품", "제품", "카탈로그", "재고", "등록", "수정", "삭제", "조회"));
    groups.put("검색", List.of("검색", "필터", "정렬", "조회", "찾기"));
    groups.put("알림", List.of("알림", "푸시", "메시지", "이메일", "SMS", "통지"));
    groups.put("관리자", List.of("관리자", "admin", "대시보드", "통계", "모니터링"));
    groups.put("데이터관리", List.of("데이터베이스", "백업", "복원", "마이그레이션", "스키마"));
    groups.put("API", List.of("API", "엔드포인트", "REST", "GraphQL", "웹훅"));
    groups.put("보안", List.of("보안", "암호화", "XSS", "CSRF", "SQL Injection", "취약점"));
    return new KeywordTaxonomy(groups);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KeywordTaxonomy other)) {
      return false;
    }
    return keywords.equals(other.keywords);
  }

  @Override
  public int hashCode() {
    return keywords.hashCode();
  }

  @Override
  public String toString() {
    return "KeywordTaxonomy" + keywords;
  }
}
