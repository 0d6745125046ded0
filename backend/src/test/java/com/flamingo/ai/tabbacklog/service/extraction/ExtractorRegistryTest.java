package com.flamingo.ai.tabbacklog.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.tabbacklog.exception.NoExtractorMatchException;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExtractorRegistry dispatch")
class ExtractorRegistryTest {

  private ExtractorRegistry registry;

  @BeforeEach
  void setUp() {
    registry =
        new ExtractorRegistry(
            List.of(
                new FixedExtractor("a", "example.com"),
                new FixedExtractor("b", "example"),
                new GenericHtmlExtractor()));
  }

  @Test
  void shouldPickFirstRegistered_whenSeveralExtractorsMatch() {
    assertThat(registry.route("https://example.com/post").name()).isEqualTo("a");
  }

  @Test
  void shouldFollowRegistrationOrder_whenOrderIsReversed() {
    ExtractorRegistry reversed =
        new ExtractorRegistry(
            List.of(
                new FixedExtractor("b", "example"),
                new FixedExtractor("a", "example.com"),
                new GenericHtmlExtractor()));

    assertThat(reversed.route("https://example.com/post").name()).isEqualTo("b");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://news.site.org/article/1",
        "http://localhost:8080/",
        "https://x.com/someone",
        "HTTPS://UPPER.EXAMPLE.NET/path?q=1",
        "https://my_site.example.com/page",
        "https://example.com/a b"
      })
  void shouldAlwaysFindExtractor_whenUrlIsValidHttp(String url) {
    assertThat(registry.selectExtractor(url)).isPresent();
  }

  @Test
  void shouldFallBackToGeneric_whenNoSpecificExtractorMatches() {
    assertThat(registry.route("https://blog.other.org/entry").name())
        .isEqualTo(GenericHtmlExtractor.SITE_KIND);
  }

  @Test
  void shouldThrow_whenUrlIsNotHttp() {
    assertThat(registry.selectExtractor("ftp://files.other.org/x")).isEmpty();
    assertThatThrownBy(() -> registry.route("mailto:someone@other.org"))
        .isInstanceOf(NoExtractorMatchException.class);
  }

  @Test
  void shouldListNamesInDispatchOrder() {
    assertThat(registry.extractorNames()).containsExactly("a", "b", "generic_html");
  }

  @Test
  void shouldDelegateExtraction_toSelectedExtractor() {
    ParsedPage page = registry.extract("https://example.com/x", "<html></html>");
    assertThat(page.siteKind()).isEqualTo("a");
  }

  private record FixedExtractor(String name, String urlFragment) implements SiteExtractor {

    @Override
    public boolean matches(String url) {
      return url.contains(urlFragment);
    }

    @Override
    public ParsedPage extract(String url, String html) {
      return new ParsedPage(name, "title", "text", 1, null, Map.of());
    }
  }
}
