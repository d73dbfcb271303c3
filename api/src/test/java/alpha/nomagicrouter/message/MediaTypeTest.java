package alpha.nomagicrouter.message;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static alpha.nomagicrouter.message.MediaType.parse;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link MediaType}.
 */
final class MediaTypeTest
{
    @Test
    void typeAndSubtype() {
        var mt = parse(" Text/HTML ");
        assertThat(mt.type()).isEqualTo("text");
        assertThat(mt.subtype()).isEqualTo("html");
        assertThat(mt.parameters()).isEmpty();
        assertThat(mt.charset()).isEmpty();
        assertThat(mt).hasToString(" Text/HTML ");
    }
    
    @Test
    void parameters() {
        var mt = parse("text/plain; Charset=\"UTF-8\"; format=flowed");
        assertThat(mt.parameters()).isEqualTo(Map.of("charset", "utf-8", "format", "flowed"));
        assertThat(mt.charset()).contains(UTF_8);
    }
    
    @Test
    void quotedSemicolon() {
        var mt = parse("multipart/form-data; boundary=\"a;b\"");
        assertThat(mt.parameters()).isEqualTo(Map.of("boundary", "a;b"));
    }
    
    @Test
    void charsetCaseKeptForNonText() {
        assertThat(parse("application/x; charset=ISO-8859-1").parameters().get("charset"))
                .isEqualTo("ISO-8859-1");
        assertThat(parse("application/x; charset=ISO-8859-1").charset()).contains(ISO_8859_1);
    }
    
    @Test
    void equality() {
        assertThat(parse("application/json;charset=utf-8"))
                .isEqualTo(MediaType.APPLICATION_JSON_UTF8)
                .hasSameHashCodeAs(MediaType.APPLICATION_JSON_UTF8);
        assertThat(parse("text/plain")).isNotEqualTo(parse("text/html"));
    }
    
    @Test
    void charset_unsupported() {
        var mt = parse("text/plain; charset=bogus-1");
        assertThatThrownBy(mt::charset)
                .isExactlyInstanceOf(ApplicationException.class)
                .hasMessage("unsupported charset \"BOGUS-1\"")
                .extracting(e -> ((ApplicationException) e).statusCode())
                .isEqualTo(415);
    }
    
    @Test
    void parseFailures() {
        assertParseFailure("", "Nothing to parse.");
        assertParseFailure("text", "Expected exactly one forward slash in <type/subtype>.");
        assertParseFailure("a/b/c", "Expected exactly one forward slash in <type/subtype>.");
        assertParseFailure("/plain", "Type is empty.");
        assertParseFailure(" /plain", "Type is empty.");
        assertParseFailure("text/ ", "Subtype is empty.");
        assertParseFailure("text/plain; charset", "A parameter has no assigned value.");
        assertParseFailure("text/plain; =utf-8", "Empty parameter name.");
        assertParseFailure("text/plain; charset=", "Empty parameter value.");
        assertParseFailure("text/plain; a=1; A=2", "Duplicated parameters.");
    }
    
    private static void assertParseFailure(String text, String reason) {
        assertThatThrownBy(() -> parse(text))
                .isExactlyInstanceOf(MediaTypeParseException.class)
                .hasMessage("Can not parse \"" + text + "\". " + reason)
                .extracting(e -> ((MediaTypeParseException) e).statusCode())
                .isEqualTo(400);
    }
}
