package org.themecheck.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class SchemeRoutingFileSystemTest {

    @Mock
    IThemeFileSystem local;

    @Mock
    IThemeFileSystem remote;

    @Test
    @Tag("unit")
    void routesByScheme() throws Exception {
        when(local.readFile("file:///theme/a.liquid")).thenReturn("local");
        SchemeRoutingFileSystem fs = new SchemeRoutingFileSystem(remote).register("file", local);

        assertThat(fs.readFile("file:///theme/a.liquid")).isEqualTo("local");
        verifyNoInteractions(remote);
    }

    @Test
    @Tag("unit")
    void pathsWithoutRegisteredSchemeGoToFallback() throws Exception {
        SchemeRoutingFileSystem fs = new SchemeRoutingFileSystem(remote).register("file", local);

        fs.stat("vscode-vfs://github/theme/a.liquid");
        fs.readDirectory("/theme");

        verify(remote).stat("vscode-vfs://github/theme/a.liquid");
        verify(remote).readDirectory("/theme");
        verifyNoInteractions(local);
    }

    @Test
    @Tag("unit")
    void driveLettersAreNotSchemes() {
        assertThat(SchemeRoutingFileSystem.schemeOf("C:\\theme\\a.liquid")).isNull();
        assertThat(SchemeRoutingFileSystem.schemeOf("/theme/a.liquid")).isNull();
        assertThat(SchemeRoutingFileSystem.schemeOf("FILE:///a")).isEqualTo("file");
    }
}
