/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.ccscan;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

public class MainTest {

    @TempDir
    File dir;

    private ByteArrayOutputStream buf;
    private PrintStream out;

    @BeforeEach
    public void setUp() throws Exception {
        buf = new ByteArrayOutputStream();
        out = new PrintStream(buf, true, "UTF-8");
    }

    private String write(String name, String content) throws Exception {
        File file = new File(dir, name);
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.getPath();
    }

    private static String key(String path) {
        return path.replace(File.separatorChar, '/');
    }

    private JsonObject output() throws Exception {
        return JsonParser.parseString(buf.toString("UTF-8")).getAsJsonObject();
    }

    @Test
    public void testHelp() throws Exception {
        assertThat(Main.run(new String[]{"--help"}, out)).isZero();
        assertThat(buf.toString("UTF-8")).contains("--group", "--platform", "--define");
    }

    @Test
    public void testBadArguments() throws Exception {
        assertThat(Main.run(new String[]{"-D", "1X"}, out)).isEqualTo(2);
        assertThat(Main.run(new String[]{"--platform", "plan9"}, out)).isEqualTo(2);
        assertThat(Main.run(new String[]{"--no-such-option"}, out)).isEqualTo(2);
        assertThat(buf.size()).isZero();
    }

    @Test
    public void testScan() throws Exception {
        String header = write("a.h", "#ifdef _WIN32\n#include <windows.h>\n#endif\n#if FEATURE\n#include \"feature.h\"\n#endif\n");
        String source = write("a.c", "#include \"a.h\"\nint main(void) { return 0; }\n");
        String other = write("b.c", "#include \"a.h\"\n");

        int status = Main.run(new String[]{
            "--group", "-DFEATURE=1", "--platform", "windows/x86_64", "-P", "linux/x86_64",
            header, source, other}, out);
        assertThat(status).isZero();

        JsonObject files = output().getAsJsonObject("files");
        assertThat(files.keySet()).containsExactlyInAnyOrder(key(header), key(source), key(other));

        JsonObject a = files.getAsJsonObject(key(source));
        assertThat(a.get("hasMain").getAsBoolean()).isTrue();
        JsonArray includes = a.getAsJsonArray("includes");
        assertThat(includes.size()).isEqualTo(1);
        assertThat(includes.get(0).getAsJsonObject().get("include").getAsString()).isEqualTo("a.h");

        JsonObject h = files.getAsJsonObject(key(header));
        assertThat(h.getAsJsonArray("includes").size()).isEqualTo(1);
        JsonObject platforms = h.getAsJsonObject("platforms");
        assertThat(platforms.getAsJsonArray("#include <windows.h>").toString()).isEqualTo("[\"windows/x86_64\"]");
        assertThat(platforms.getAsJsonArray("#include \"feature.h\"").size()).isEqualTo(2);

        JsonObject groups = output().getAsJsonObject("groups");
        assertThat(groups.keySet()).containsExactlyInAnyOrder("a", "b");
        assertThat(groups.getAsJsonObject("b").getAsJsonArray("dependsOn").toString()).isEqualTo("[\"a\"]");
    }

    @Test
    public void testUnreadableFilesAreSkipped() throws Exception {
        String good = write("good.c", "#include <stdio.h>\n");
        String bad = write("bad.c", "/* never closed\n");
        String missing = new File(dir, "missing.c").getPath();

        assertThat(Main.run(new String[]{good, bad, missing}, out)).isEqualTo(1);
        JsonObject files = output().getAsJsonObject("files");
        assertThat(files.keySet()).containsExactly(key(good));
        assertThat(output().has("groups")).isFalse();
    }

    @Test
    public void testDebugPrintsEnvironments() throws Exception {
        String source = write("x.c", "");
        assertThat(Main.run(new String[]{"--debug", "-D", "A", "-U", "A", "-D", "B=2", "-P", "linux", source}, out)).isZero();
        JsonObject environments = output().getAsJsonObject("environments");
        assertThat(environments.getAsJsonObject("").toString()).isEqualTo("{\"B\":2}");
        assertThat(environments.getAsJsonObject("linux").has("__linux__")).isTrue();
    }

    @Test
    public void testTokens() throws Exception {
        String source = write("t.c", "#if A\n");
        assertThat(Main.run(new String[]{"--tokens", source}, out)).isZero();
        JsonArray tokens = output().getAsJsonObject("files").getAsJsonObject(key(source)).getAsJsonArray("tokens");
        assertThat(tokens.size()).isEqualTo(4);
        JsonObject first = tokens.get(0).getAsJsonObject();
        assertThat(first.get("type").getAsString()).isEqualTo("DIRECTIVE");
        assertThat(first.get("value").getAsString()).isEqualTo("if");
        assertThat(first.get("at").getAsString()).isEqualTo("1:1");
    }
}
