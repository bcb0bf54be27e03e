/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContactTableTest {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testReadCsv() throws IOException {
    Path csv = write("Name,Phone\n\"López, Ana\",\"214 555 1212, 817 555 1212\"\nBeto\n\n");
    ContactTable table = ContactTable.read(csv);

    assertThat(table.header()).containsExactly("Name", "Phone").inOrder();
    assertThat(table.rows())
        .containsExactly(
            ImmutableMap.of("Name", "López, Ana", "Phone", "214 555 1212, 817 555 1212"),
            ImmutableMap.of("Name", "Beto", "Phone", ""))
        .inOrder();
  }

  @Test
  public void testReadTsvWithByteOrderMark() throws IOException {
    Path tsv = write("\uFEFFName\tPhone 1 - Value\nAna\t2145551212, 8175551212\n");
    ContactTable table = ContactTable.read(tsv);

    assertThat(table.header()).containsExactly("Name", "Phone 1 - Value").inOrder();
    assertThat(table.rows())
        .containsExactly(
            ImmutableMap.of("Name", "Ana", "Phone 1 - Value", "2145551212, 8175551212"));
  }

  @Test
  public void testWrite() throws IOException {
    Path out = tmp.getRoot().toPath().resolve("out.csv");
    ContactTable.write(
        out,
        ImmutableList.of("Name", "Phone_E164", "OptIn"),
        ImmutableList.of(
            ImmutableMap.of("Name", "López, Ana", "Phone_E164", "+525512345678"),
            ImmutableMap.of("Name", "Beto", "Phone_E164", "+12145551212", "OptIn", "yes")));

    assertThat(Files.readAllLines(out, UTF_8))
        .containsExactly(
            "Name,Phone_E164,OptIn", "\"López, Ana\",+525512345678,", "Beto,+12145551212,yes")
        .inOrder();

    ContactTable table = ContactTable.read(out);
    assertThat(table.rows().get(0)).containsEntry("Name", "López, Ana");
    assertThat(table.rows().get(0)).containsEntry("OptIn", "");
  }

  private Path write(String content) throws IOException {
    Path path = tmp.newFile().toPath();
    Files.write(path, content.getBytes(UTF_8));
    return path;
  }
}
