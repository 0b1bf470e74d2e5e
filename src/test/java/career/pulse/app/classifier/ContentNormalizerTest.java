package career.pulse.app.classifier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentNormalizerTest {

    private final ContentNormalizer normalizer = new ContentNormalizer();

    @Test
    void normalize_WithMarkup_ShouldStripTagsAndDecodeEntities() {
        // Given
        String html = "<div>Hello&nbsp;<b>World</b> &amp; Co</div><p>Line&nbsp;2</p>";

        // When
        String text = normalizer.normalize(html);

        // Then
        assertEquals("Hello World & Co\nLine 2", text);
    }

    @Test
    void normalize_WithLineBreaks_ShouldKeepLineStructure() {
        // Given
        String html = "<html><body><p>Position: Backend Engineer<br>Location: Berlin</p><script>var x;</script></body></html>";

        // When
        String text = normalizer.normalize(html);

        // Then
        assertTrue(text.contains("Position: Backend Engineer\nLocation: Berlin"), text);
    }

    @Test
    void normalize_WithUnicode_ShouldPreserveCharacters() {
        // Given
        String plain = "Zoë applied to Café Noir · 東京 office ☕";

        // When & Then
        assertEquals(plain, normalizer.normalize(plain));
        assertEquals("Société Générale", normalizer.normalize("<span>Soci&eacute;t&eacute; G&eacute;n&eacute;rale</span>"));
    }

    @Test
    void normalize_WithPlainTextComparisons_ShouldNotTreatAsMarkup() {
        // Given
        String plain = "Salary 5 < 6 and 7 > 3";

        // When & Then
        assertFalse(normalizer.isMarkup(plain));
        assertEquals(plain, normalizer.normalize(plain));
    }

    @Test
    void normalize_WithNullOrBlank_ShouldReturnEmpty() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize(" \r\n\t "));
    }

    @Test
    void normalize_ShouldCollapseWhitespaceAndBlankLines() {
        assertEquals("one two\nthree", normalizer.normalize("one   \t two\r\n\r\n\r\n   three  "));
    }
}
