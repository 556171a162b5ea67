package com.bbthechange.bridge.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisplaynameFormatterTest {

    @Test
    @DisplayName("should join first and last name for the name preference")
    void format_NamePreference_UsesComposite() {
        DisplaynameFormatter formatter = new DisplaynameFormatter(List.of("name"), "{displayname}");

        assertThat(formatter.format("Ada", "Lovelace")).isEqualTo("Ada Lovelace");
    }

    @Test
    @DisplayName("should fall through to the next preference when a field is empty")
    void format_EmptyPreferredField_UsesNextOne() {
        DisplaynameFormatter formatter = new DisplaynameFormatter(
                List.of("displayname", "last_name", "first_name"), "{displayname} (LinkedIn)");

        assertThat(formatter.format("Ada", "")).isEqualTo("Ada (LinkedIn)");
        assertThat(formatter.format("Ada", "Lovelace")).isEqualTo("Lovelace (LinkedIn)");
    }

    @Test
    @DisplayName("should render every template field")
    void format_AllFields_Rendered() {
        DisplaynameFormatter formatter = new DisplaynameFormatter(
                List.of("first_name"), "{displayname}|{name}|{first_name}|{last_name}");

        assertThat(formatter.format("Ada", "Lovelace")).isEqualTo("Ada|Ada Lovelace|Ada|Lovelace");
    }

    @Test
    @DisplayName("should render missing values as empty text")
    void format_MissingNames_RenderEmpty() {
        DisplaynameFormatter formatter = new DisplaynameFormatter(List.of("name"), "{displayname} (LinkedIn)");

        assertThat(formatter.format(null, "Lovelace")).isEqualTo("Lovelace (LinkedIn)");
        assertThat(formatter.format(null, null)).isEqualTo("(LinkedIn)");
    }

    @Test
    @DisplayName("should keep dollar signs and backslashes in names literally")
    void format_SpecialCharacters_NotInterpreted() {
        DisplaynameFormatter formatter = new DisplaynameFormatter(List.of("name"), "{displayname}");

        assertThat(formatter.format("$1", "a\\b")).isEqualTo("$1 a\\b");
    }

    @Test
    @DisplayName("should reject unknown template fields")
    void constructor_UnknownField_Throws() {
        assertThatThrownBy(() -> new DisplaynameFormatter(List.of("name"), "{nickname}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("{nickname}");
    }
}
