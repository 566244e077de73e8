package org.openfoodfacts.robotoff.utils;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.util.List;

@UtilityClass
public class BarcodeUtil {

    public static boolean isBarcode(String text) {
        return text.length() == 13 && text.chars().allMatch(Character::isDigit);
    }

    /**
     * Splits a barcode into the directory levels used by the product image server.
     */
    public static List<String> splitBarcode(String barcode) {
        if (barcode != null && barcode.length() == 13) {
            return List.of(barcode.substring(0, 3), barcode.substring(3, 6), barcode.substring(6, 9), barcode.substring(9, 13));
        } else if (barcode != null && barcode.length() == 8) {
            return List.of(barcode);
        }

        throw new IllegalArgumentException("unknown barcode format: " + barcode);
    }

    /**
     * Rebuilds the barcode from the numeric directories right above the file,
     * {@code /301/762/042/2003/1.jpg} giving {@code 3017620422003}.
     *
     * @return the barcode, {@code null} when the direct parent is not numeric
     */
    public static String getBarcodeFromPath(String path) {
        if (path == null) {
            return null;
        }

        StringBuilder barcode = new StringBuilder();
        Path parent = Path.of(path).getParent();
        while (parent != null && parent.getFileName() != null && isDigits(parent.getFileName().toString())) {
            barcode.insert(0, parent.getFileName().toString());
            parent = parent.getParent();
        }
        return barcode.length() > 0 ? barcode.toString() : null;
    }

    /**
     * @return the image path relative to the product image root, {@code /301/762/042/2003/1.jpg}
     */
    public static String getSource(String imageName, String barcode) {
        return "/" + String.join("/", splitBarcode(barcode)) + "/" + imageName + ".jpg";
    }

    private static boolean isDigits(String text) {
        return !text.isEmpty() && text.chars().allMatch(Character::isDigit);
    }
}
