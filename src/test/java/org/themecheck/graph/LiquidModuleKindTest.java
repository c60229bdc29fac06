package org.themecheck.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LiquidModuleKindTest {

    @Test
    @Tag("unit")
    void infersKindFromDirectoryAndExtension() {
        assertThat(LiquidModuleKind.fromPath("templates/customers/account.liquid")).contains(LiquidModuleKind.TEMPLATE);
        assertThat(LiquidModuleKind.fromPath("templates/index.json")).contains(LiquidModuleKind.TEMPLATE);
        assertThat(LiquidModuleKind.fromPath("sections/header-group.json")).contains(LiquidModuleKind.SECTION);
        assertThat(LiquidModuleKind.fromPath("assets/logo.svg")).contains(LiquidModuleKind.ASSET);
        assertThat(LiquidModuleKind.fromPath("snippets/data.json")).isEmpty();
        assertThat(LiquidModuleKind.fromPath("config/settings_schema.json")).isEmpty();
        assertThat(LiquidModuleKind.fromPath("README.md")).isEmpty();
    }

    @Test
    @Tag("unit")
    void serializesLowerCase() {
        assertThat(LiquidModuleKind.SNIPPET.toString()).isEqualTo("snippet");
        assertThat(LiquidModuleKind.LAYOUT.isEntryPoint()).isTrue();
        assertThat(LiquidModuleKind.BLOCK.isEntryPoint()).isFalse();
    }
}
