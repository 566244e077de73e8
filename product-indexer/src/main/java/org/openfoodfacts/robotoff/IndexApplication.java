package org.openfoodfacts.robotoff;

import org.openfoodfacts.robotoff.service.IndexService;
import org.openfoodfacts.robotoff.service.ProductExportService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.util.List;

import static java.util.Arrays.asList;

@SpringBootApplication(scanBasePackages = {"org.openfoodfacts.robotoff"})
public class IndexApplication implements CommandLineRunner {

    static final String CREATE_NEW_INDEX_ARG = "createNewIndex";
    static final String EXPORT_PRODUCTS_ARG = "exportProducts";

    @Value("${elasticsearch.index.alias}")
    private String prefixIndexName;

    @Value("${elasticsearch.index.indices-amount}")
    private Long keepIndicesAmount;

    @Autowired
    IndexService indexService;

    @Autowired
    ProductExportService productExportService;

    public static void main(String[] args) {
        String[] runArgs = args.length == 0 ? new String[]{CREATE_NEW_INDEX_ARG, EXPORT_PRODUCTS_ARG} : args;
        SpringApplication.run(IndexApplication.class, runArgs);
    }

    @Override
    public void run(String... strings) throws IOException {
        List<String> args = asList(strings);
        if (args.contains(CREATE_NEW_INDEX_ARG)) {
            indexService.createIndex();
            indexService.deletePreviousIndices(prefixIndexName, keepIndicesAmount);
        }
        if (args.contains(EXPORT_PRODUCTS_ARG)) {
            productExportService.exportProducts();
        }
    }
}
