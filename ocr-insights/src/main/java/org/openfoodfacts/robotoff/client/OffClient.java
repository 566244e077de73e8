package org.openfoodfacts.robotoff.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openfoodfacts.robotoff.config.OffProperties;
import org.openfoodfacts.robotoff.utils.BarcodeUtil;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the Open Food Facts product API and image server.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OffClient {

    private final RestTemplate offRestTemplate;

    private final OffProperties offProperties;

    /**
     * @return the image keys of the product, in the order the API lists them
     */
    public List<String> fetchImageNames(String barcode) {
        String url = offProperties.getApiUrl() + "/api/v0/product/" + barcode + ".json?fields=images";
        JsonNode body = offRestTemplate.getForObject(url, JsonNode.class);

        List<String> imageNames = new ArrayList<>();
        if (body == null) {
            return imageNames;
        }
        Iterator<String> names = body.path("product").path("images").fieldNames();
        names.forEachRemaining(imageNames::add);
        return imageNames;
    }

    /**
     * @return the OCR JSON stored next to the image, empty when the image was never OCRed
     */
    public Optional<JsonNode> fetchOcrJson(String barcode, String imageName) {
        String url = generateOcrUrl(barcode, imageName);
        try {
            return Optional.ofNullable(offRestTemplate.getForObject(url, JsonNode.class));
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("No OCR at {}", url);
            return Optional.empty();
        }
    }

    public String generateOcrUrl(String barcode, String imageName) {
        return offProperties.getStaticUrl() + "/images/products/"
                + String.join("/", BarcodeUtil.splitBarcode(barcode)) + "/" + imageName + ".json";
    }
}
