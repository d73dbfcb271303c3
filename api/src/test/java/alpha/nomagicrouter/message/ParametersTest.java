package alpha.nomagicrouter.message;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Parameters}.
 */
final class ParametersTest
{
    @Test
    void empty() {
        var p = Parameters.empty();
        assertThat(p.isEmpty()).isTrue();
        assertThat(p.get("x")).isNull();
        assertThat(p.getAll("x")).isEmpty();
        assertThat(p.contains("x")).isFalse();
        assertThat(Parameters.builder().build()).isSameAs(p);
    }
    
    @Test
    void singleAndRepeated() {
        var p = Parameters.builder()
                .add("b", "1")
                .add("a", "2")
                .add("a", "3")
                .build();
        assertThat(p.names()).containsExactly("b", "a");
        assertThat(p.get("a")).isEqualTo("2");
        assertThat(p.getAll("a")).containsExactly("2", "3");
        assertThat(p.isRepeated("a")).isTrue();
        assertThat(p.isRepeated("b")).isFalse();
        assertThat(p.asMap()).isEqualTo(Map.of("b", "1", "a", List.of("2", "3")));
        assertThat(p).hasToString("{b=1, a=[2, 3]}");
    }
    
    @Test
    void setAll() {
        var p = Parameters.builder()
                .add("x", "old")
                .setAll("x", List.of("new"))
                .build();
        assertThat(p.isRepeated("x")).isTrue();
        assertThat(p.getAll("x")).containsExactly("new");
    }
    
    @Test
    void setAll_empty() {
        assertThatThrownBy(() -> Parameters.builder().setAll("x", List.of()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("No values for x");
    }
    
    @Test
    void builderDoesNotLeak() {
        var b = Parameters.builder().add("x", "1");
        var first = b.build();
        b.add("x", "2");
        assertThat(first.getAll("x")).containsExactly("1");
        assertThat(b.build().getAll("x")).containsExactly("1", "2");
    }
    
    @Test
    void equality() {
        var a = Parameters.builder().add("x", "1").build();
        var b = Parameters.builder().add("x", "1").build();
        var c = Parameters.builder().setAll("x", List.of("1")).build();
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }
    
    @Test
    void asMap_unmodifiable() {
        var m = Parameters.builder().add("x", "1").build().asMap();
        assertThatThrownBy(() -> m.put("y", "2"))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
