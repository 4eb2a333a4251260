package rasterlab.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void unknownPathReturnsNotFoundProblem() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/nowhere",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<Map<String, Object>>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(response.getBody()).containsEntry("path", "/v1/nowhere");
  }

  @Test
  void wrongMethodReturnsMethodNotAllowedProblem() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/draw",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<Map<String, Object>>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    assertThat(response.getBody()).containsEntry("status", 405);
  }

  @Test
  void nonJsonBodyReturnsUnsupportedMediaTypeProblem() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.TEXT_PLAIN);

    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/draw",
        HttpMethod.POST,
        new HttpEntity<>("algorithm=dda", headers),
        new ParameterizedTypeReference<Map<String, Object>>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    assertThat(response.getBody()).containsEntry("status", 415);
  }
}
