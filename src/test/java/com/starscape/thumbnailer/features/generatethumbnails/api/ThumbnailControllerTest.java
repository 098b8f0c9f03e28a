package com.starscape.thumbnailer.features.generatethumbnails.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ThumbnailControllerTest {

    private static final Path WORK_DIR;
    private static final Path SOURCE_DIR;
    private static final Path OUTPUT_DIR;

    static {
        try {
            WORK_DIR = Files.createTempDirectory("thumbnailer-api");
            SOURCE_DIR = Files.createDirectory(WORK_DIR.resolve("in"));
            OUTPUT_DIR = Files.createDirectory(WORK_DIR.resolve("out"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private ObjectMapper objectMapper;

    private Path source;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("app.thumbnailer.http.source-folder", () -> SOURCE_DIR.toUri().toString());
        registry.add("app.thumbnailer.http.destination-folder", () -> OUTPUT_DIR.toUri().toString());
    }

    @BeforeEach
    void setUp() throws IOException {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";

        source = SOURCE_DIR.resolve("cat-" + System.nanoTime() + ".png");
        ImageIO.write(new BufferedImage(80, 40, BufferedImage.TYPE_INT_ARGB), "png", source.toFile());
    }

    private Map<String, Object> jobRequest(List<Map<String, Object>> options) {
        return Map.of(
            "srcImage", source.toUri().toString(),
            "dstFolder", OUTPUT_DIR.toUri().toString(),
            "deleteSrc", false,
            "opts", options
        );
    }

    private static String baseName(Path path) {
        String name = path.getFileName().toString();
        return name.substring(0, name.lastIndexOf('.'));
    }

    @Test
    void shouldGenerateThumbnailsFromJsonBody() {
        given()
                .contentType(ContentType.JSON)
                .body(jobRequest(List.of(
                    Map.of("width", 20, "height", 0),
                    Map.of("rect", Map.of("min", List.of(0, 0), "max", List.of(40, 40)), "width", 10, "height", 10))))
                .post("/thumbs")
                .then()
                .statusCode(200)
                .body("$", hasSize(2))
                .body("[0].thumbnail", endsWith("/" + baseName(source) + "_s20x10.png"))
                .body("[0].err", nullValue())
                .body("[1].thumbnail", endsWith("/" + baseName(source) + "_c0-0-40-40_s10x10.png"));

        assertTrue(Files.exists(OUTPUT_DIR.resolve(baseName(source) + "_s20x10.png")));
    }

    @Test
    void shouldReportPartialFailureWithEveryResult() {
        given()
                .contentType(ContentType.JSON)
                .body(jobRequest(List.of(
                    Map.of("width", 20, "height", 20),
                    Map.of("dstImage", OUTPUT_DIR.resolve("bad.webp").toUri().toString(), "width", 20, "height", 20))))
                .post("/thumbs")
                .then()
                .statusCode(500)
                .body("$", hasSize(2))
                .body("[0].thumbnail", notNullValue())
                .body("[1].thumbnail", nullValue())
                .body("[1].err", containsString("bad.webp"));
    }

    @Test
    void shouldRejectUnsupportedSourceScheme() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "srcImage", "ftp://host/cat.png",
                    "dstFolder", OUTPUT_DIR.toUri().toString(),
                    "opts", List.of(Map.of("width", 10, "height", 10))))
                .post("/thumbs")
                .then()
                .statusCode(400)
                .body("code", equalTo("SCHEME"));
    }

    @Test
    void shouldReturnNotFoundForMissingSource() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "srcImage", SOURCE_DIR.resolve("missing.png").toUri().toString(),
                    "dstFolder", OUTPUT_DIR.toUri().toString(),
                    "opts", List.of(Map.of("width", 10, "height", 10))))
                .post("/thumbs")
                .then()
                .statusCode(404)
                .body("code", equalTo("IO"));
    }

    @Test
    void shouldRejectNegativeSize() {
        given()
                .contentType(ContentType.JSON)
                .body(jobRequest(List.of(Map.of("width", -1, "height", 10))))
                .post("/thumbs")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"));
    }

    @Test
    void shouldAcceptBase64EncodedRequest() throws Exception {
        String json = objectMapper.writeValueAsString(jobRequest(List.of(Map.of("width", 16, "height", 8))));

        given()
                .get("/thumbs/" + Base64.encodeBase64URLSafeString(json.getBytes()))
                .then()
                .statusCode(200)
                .body("[0].thumbnail", endsWith("_s16x8.png"));
    }

    @Test
    void shouldRejectUndecodableEncodedRequest() {
        given()
                .get("/thumbs/not*base64")
                .then()
                .statusCode(400);
    }

    @Test
    void shouldResizeFileFromConfiguredFolder() {
        given()
                .get("/thumb/40x20/" + source.getFileName())
                .then()
                .statusCode(200)
                .body("[0].thumbnail", endsWith("/" + baseName(source) + "_s40x20.png"));

        assertTrue(Files.exists(OUTPUT_DIR.resolve(baseName(source) + "_s40x20.png")));
        assertTrue(Files.exists(source));
    }

    @Test
    void shouldRejectParentReferenceInFileName() {
        given()
                .get("/thumb/40x20/..secret.png")
                .then()
                .statusCode(400);
    }
}
