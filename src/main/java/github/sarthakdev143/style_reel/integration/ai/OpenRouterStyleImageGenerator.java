package github.sarthakdev143.style_reel.integration.ai;

import com.fasterxml.jackson.annotation.JsonProperty;
import github.sarthakdev143.style_reel.config.StyleReelProperties;
import github.sarthakdev143.style_reel.exception.StyleGenerationException;
import github.sarthakdev143.style_reel.model.GeneratedImage;
import github.sarthakdev143.style_reel.model.GenerationFailureKind;
import github.sarthakdev143.style_reel.service.StyleImageGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.net.SocketTimeoutException;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class OpenRouterStyleImageGenerator implements StyleImageGenerator {

    private static final Logger logger = LoggerFactory.getLogger(OpenRouterStyleImageGenerator.class);
    private static final JsonMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private static final Pattern DATA_URL_PATTERN =
            Pattern.compile("data:(image/(?:png|jpeg|jpg|webp));base64,([A-Za-z0-9+/=]+)");
    private static final String DATA_URL_PREFIX = "data:image/";

    private final RestTemplate restTemplate;
    private final StyleReelProperties.Ai ai;

    public OpenRouterStyleImageGenerator(
            @Qualifier("styleGeneratorRestTemplate") RestTemplate restTemplate,
            StyleReelProperties properties) {
        this.restTemplate = restTemplate;
        this.ai = properties.ai();
    }

    @Override
    public GeneratedImage generate(byte[] sourceImage, String contentType, String styleId, String prompt)
            throws StyleGenerationException {
        if (ai.apiKey() == null || ai.apiKey().isBlank()) {
            throw new StyleGenerationException(GenerationFailureKind.INVALID_INPUT, "AI api key is not configured.");
        }
        if (sourceImage == null || sourceImage.length == 0) {
            throw new StyleGenerationException(GenerationFailureKind.INVALID_INPUT, "Source image is empty.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(ai.apiKey());

        String responseBody;
        try {
            String requestJson = MAPPER.writeValueAsString(buildRequestBody(sourceImage, contentType, prompt));
            ResponseEntity<String> response = restTemplate.exchange(
                    ai.baseUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>(requestJson, headers),
                    String.class);
            responseBody = response.getBody();
        } catch (HttpClientErrorException e) {
            throw new StyleGenerationException(
                    classifyStatus(e.getStatusCode().value()),
                    "Generator rejected style '" + styleId + "' with status " + e.getStatusCode().value() + ".",
                    e);
        } catch (HttpServerErrorException e) {
            throw new StyleGenerationException(
                    classifyStatus(e.getStatusCode().value()),
                    "Generator failed for style '" + styleId + "' with status " + e.getStatusCode().value() + ".",
                    e);
        } catch (ResourceAccessException e) {
            GenerationFailureKind kind = e.getCause() instanceof SocketTimeoutException
                    ? GenerationFailureKind.TIMEOUT
                    : GenerationFailureKind.UPSTREAM_ERROR;
            throw new StyleGenerationException(kind, "Generator unreachable: " + e.getMessage(), e);
        }

        if (responseBody == null || responseBody.isBlank()) {
            throw new StyleGenerationException(GenerationFailureKind.UPSTREAM_ERROR, "Generator returned an empty body.");
        }
        return extractImage(responseBody, styleId);
    }

    Map<String, Object> buildRequestBody(byte[] sourceImage, String contentType, String prompt) {
        String imageType = contentType == null || contentType.isBlank() ? "image/jpeg" : contentType;
        String dataUrl = "data:" + imageType + ";base64," + Base64.getEncoder().encodeToString(sourceImage);
        return Map.of(
                "model", ai.model(),
                "modalities", List.of("image", "text"),
                "messages", List.of(Map.of(
                        "role", "user",
                        "content", List.of(
                                Map.of("type", "text", "text", prompt),
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl))))));
    }

    GeneratedImage extractImage(String responseBody, String styleId) throws StyleGenerationException {
        ChatCompletionResponse response;
        try {
            response = MAPPER.readValue(responseBody, ChatCompletionResponse.class);
        } catch (JacksonException e) {
            logger.warn("Generator response for style '{}' is not valid JSON; scanning raw body", styleId);
            response = null;
        }

        if (response != null && response.error() != null && (response.choices() == null || response.choices().isEmpty())) {
            GenerationFailureKind kind = response.error().code() instanceof Number number
                    ? classifyStatus(number.intValue())
                    : GenerationFailureKind.UPSTREAM_ERROR;
            throw new StyleGenerationException(kind, "Generator error: " + response.error().message());
        }

        String dataUrl = response == null ? null : findDataUrl(response);
        if (dataUrl == null) {
            Matcher matcher = DATA_URL_PATTERN.matcher(responseBody);
            if (matcher.find()) {
                dataUrl = matcher.group();
            }
        }
        if (dataUrl == null) {
            throw new StyleGenerationException(
                    GenerationFailureKind.UPSTREAM_ERROR,
                    "Generator response for style '" + styleId + "' contained no image.");
        }
        return decodeDataUrl(dataUrl);
    }

    private String findDataUrl(ChatCompletionResponse response) {
        if (response.choices() == null || response.choices().isEmpty() || response.choices().get(0).message() == null) {
            return null;
        }
        ChatMessage message = response.choices().get(0).message();

        if (message.images() != null) {
            for (ImagePart image : message.images()) {
                if (image != null && image.imageUrl() != null && isImageDataUrl(image.imageUrl().url())) {
                    return image.imageUrl().url();
                }
            }
        }

        if (message.content() instanceof List<?> parts) {
            for (Object part : parts) {
                if (!(part instanceof Map<?, ?> item)) {
                    continue;
                }
                if (item.get("image_url") instanceof Map<?, ?> imageUrl && isImageDataUrl(imageUrl.get("url"))) {
                    return (String) imageUrl.get("url");
                }
                if (isImageDataUrl(item.get("url"))) {
                    return (String) item.get("url");
                }
                if (item.get("image_base64") instanceof String base64 && !base64.isBlank()) {
                    return "data:image/png;base64," + base64;
                }
            }
        }
        return null;
    }

    private GeneratedImage decodeDataUrl(String dataUrl) throws StyleGenerationException {
        int separator = dataUrl.indexOf(";base64,");
        if (separator < 0) {
            throw new StyleGenerationException(GenerationFailureKind.UPSTREAM_ERROR, "Image data URL is not base64.");
        }
        String contentType = dataUrl.substring("data:".length(), separator);
        if ("image/jpg".equals(contentType)) {
            contentType = "image/jpeg";
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(dataUrl.substring(separator + ";base64,".length()));
            return new GeneratedImage(bytes, contentType);
        } catch (IllegalArgumentException e) {
            throw new StyleGenerationException(GenerationFailureKind.UPSTREAM_ERROR, "Image data URL is malformed.", e);
        }
    }

    private boolean isImageDataUrl(Object value) {
        return value instanceof String url && url.startsWith(DATA_URL_PREFIX);
    }

    private GenerationFailureKind classifyStatus(int status) {
        if (status == 429) {
            return GenerationFailureKind.RATE_LIMITED;
        }
        if (status == 408 || status == 504) {
            return GenerationFailureKind.TIMEOUT;
        }
        if (status == 400 || status == 413 || status == 415 || status == 422) {
            return GenerationFailureKind.INVALID_INPUT;
        }
        return GenerationFailureKind.UPSTREAM_ERROR;
    }

    record ChatCompletionResponse(List<ChatChoice> choices, ChatError error) {
    }

    record ChatChoice(ChatMessage message) {
    }

    record ChatMessage(Object content, List<ImagePart> images) {
    }

    record ImagePart(@JsonProperty("image_url") ImageUrl imageUrl) {
    }

    record ImageUrl(String url) {
    }

    record ChatError(String message, Object code) {
    }
}
