package org.proxyrotor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RequestBodyTest {

  private static String text(RequestBody body) {
    return new String(body.bytes(), StandardCharsets.UTF_8);
  }

  @Test
  void emptyBodyHasNoContentType() {
    assertThat(RequestBody.empty().isEmpty()).isTrue();
    assertThat(RequestBody.empty().contentType()).isNull();
  }

  @Test
  void textBodyIsUtf8() {
    RequestBody body = RequestBody.of("héllo");

    assertThat(body.contentType()).isEqualTo(RequestBody.TEXT_PLAIN);
    assertThat(body.bytes()).hasSize(6);
  }

  @Test
  void jsonBodySerializesObjectsAndPassesStringsThrough() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("name", "proxy");
    value.put("port", 1080);

    assertThat(text(RequestBody.json(value))).isEqualTo("{\"name\":\"proxy\",\"port\":1080}");
    assertThat(text(RequestBody.json("[1,2]"))).isEqualTo("[1,2]");
    assertThat(RequestBody.json(value).contentType()).isEqualTo(RequestBody.APPLICATION_JSON);
  }

  @Test
  void formBodyIsUrlEncodedAndSkipsNullValues() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("q", "a b&c");
    fields.put("skip", null);
    fields.put("n", 3);

    RequestBody body = RequestBody.form(fields);

    assertThat(text(body)).isEqualTo("q=a+b%26c&n=3");
    assertThat(body.contentType()).isEqualTo(RequestBody.FORM_URLENCODED);
  }

  @Test
  void streamIsReadOnceAndClosed() {
    AtomicBoolean closed = new AtomicBoolean();
    InputStream stream =
        new ByteArrayInputStream(new byte[] {1, 2, 3}) {
          @Override
          public void close() throws IOException {
            closed.set(true);
            super.close();
          }
        };

    RequestBody body = RequestBody.of(stream, RequestBody.OCTET_STREAM);

    assertThat(body.bytes()).containsExactly(1, 2, 3);
    assertThat(body.bytes()).containsExactly(1, 2, 3);
    assertThat(closed).isTrue();
  }

  @Test
  void brokenStreamFailsEveryRead() {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("disk gone");
          }
        };
    RequestBody body = RequestBody.of(broken, null);

    assertThatThrownBy(body::bytes)
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("disk gone");
    assertThatThrownBy(body::bytes).isInstanceOf(UncheckedIOException.class);
  }

  @Test
  void multipartWithFilesIsEncodedPerRfc7578() {
    RequestBody body =
        MultipartBody.builder()
            .withBoundary("XyZ")
            .addField("title", "report")
            .addFile("upload", "data.bin", null, new byte[] {0x00, (byte) 0xff})
            .build();

    assertThat(body).isInstanceOf(MultipartBody.class);
    assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=XyZ");
    byte[] expectedHead =
        ("--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"title\"\r\n"
                + "\r\n"
                + "report\r\n"
                + "--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"upload\"; filename=\"data.bin\"\r\n"
                + "Content-Type: application/octet-stream\r\n"
                + "\r\n")
            .getBytes(StandardCharsets.UTF_8);
    byte[] expectedTail = "\r\n--XyZ--\r\n".getBytes(StandardCharsets.UTF_8);
    byte[] bytes = body.bytes();
    assertThat(bytes).startsWith(expectedHead).endsWith(expectedTail);
    assertThat(bytes).hasSize(expectedHead.length + 2 + expectedTail.length);
    assertThat(bytes[expectedHead.length + 1]).isEqualTo((byte) 0xff);
  }

  @Test
  void multipartEscapesQuotesAndLineBreaksInNames() {
    MultipartBody body =
        (MultipartBody)
            MultipartBody.builder()
                .withBoundary("b")
                .addFile("f", "evil\"\r\nname.txt", "text/plain", new byte[0])
                .build();

    assertThat(text(body)).contains("filename=\"evil%22%0D%0Aname.txt\"");
    assertThat(body.getParts()).hasSize(1);
    assertThat(body.getParts().get(0).isFile()).isTrue();
  }

  @Test
  void multipartWithoutFilesFallsBackToUrlEncodedForm() {
    RequestBody body =
        MultipartBody.builder().addField("tag", "a").addField("tag", "b c").build();

    assertThat(body).isNotInstanceOf(MultipartBody.class);
    assertThat(body.contentType()).isEqualTo(RequestBody.FORM_URLENCODED);
    assertThat(text(body)).isEqualTo("tag=a&tag=b+c");
  }

  @Test
  void generatedBoundariesDiffer() {
    MultipartBody first =
        (MultipartBody) MultipartBody.builder().addFile("f", "a", null, new byte[0]).build();
    MultipartBody second =
        (MultipartBody) MultipartBody.builder().addFile("f", "a", null, new byte[0]).build();

    assertThat(first.getBoundary()).startsWith("----ProxyRotorBoundary").hasSizeLessThan(71);
    assertThat(first.getBoundary()).isNotEqualTo(second.getBoundary());
  }

  @Test
  void filesAreReadFromDisk(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("notes.txt");
    Files.write(file, "line".getBytes(StandardCharsets.UTF_8));

    MultipartBody body =
        (MultipartBody) MultipartBody.builder().withBoundary("q").addFile("doc", file).build();

    assertThat(text(body)).contains("filename=\"notes.txt\"").contains("\r\nline\r\n");
    assertThatThrownBy(() -> MultipartBody.builder().addFile("doc", dir.resolve("missing")))
        .isInstanceOf(UncheckedIOException.class);
  }

  @Test
  void boundaryLengthIsChecked() {
    assertThatThrownBy(() -> MultipartBody.builder().withBoundary(""))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MultipartBody.builder().withBoundary("x".repeat(71)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
