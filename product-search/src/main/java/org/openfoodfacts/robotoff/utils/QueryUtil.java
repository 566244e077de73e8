package org.openfoodfacts.robotoff.utils;

import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import lombok.experimental.UtilityClass;
import org.openfoodfacts.robotoff.config.EsFieldsConfig;
import org.openfoodfacts.robotoff.enums.MatchType;

import java.util.List;
import java.util.Locale;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

@UtilityClass
public class QueryUtil {

    // words as the standard tokenizer sees them: elisions (d'olive) and dotted words stay whole,
    // a comma only joins digits (6,6)
    private static final Pattern TOKEN = Pattern.compile(
            "[\\p{L}\\p{N}]+(?:(?:['\u2019.]|(?<=\\p{N}),(?=\\p{N}))[\\p{L}\\p{N}]+)*");

    public static Query buildQueryByMatchType(MatchType matchType, String queryText, EsFieldsConfig esFieldsConfig) {
        EsFieldsConfig.Fields fields = esFieldsConfig.getFields();
        String ingredientsField = fields.getIngredientsTextFr();

        return switch (matchType) {
            case FULL_TEXT -> buildFullTextQuery(queryText, ingredientsField);
            case TRIGRAM -> buildTrigramQuery(queryText, ingredientsField + "." + fields.getTrigram());
            case SUFFIX -> buildSuffixQuery(queryText, ingredientsField + "." + fields.getReverse());
            case ALL -> buildDisMaxQuery(List.of(
                            buildFullTextQuery(queryText, ingredientsField),
                            buildTrigramQuery(queryText, ingredientsField + "." + fields.getTrigram()),
                            buildSuffixQuery(queryText, ingredientsField + "." + fields.getReverse())),
                    esFieldsConfig.getQuery().getTieBreaker());
        };
    }

    public static Query buildFullTextQuery(String queryText, String field) {
        return Query.of(q -> q
                .match(m -> m
                        .field(field)
                        .query(queryText)
                        .operator(Operator.And)
                )
        );
    }

    public static Query buildTrigramQuery(String queryText, String field) {
        return Query.of(q -> q
                .match(m -> m
                        .field(field)
                        .query(queryText)
                )
        );
    }

    /**
     * Every token must end one of the indexed words: the reversed token is used as a prefix
     * of the reversed words indexed by the {@code reverse} analyzer.
     */
    public static Query buildSuffixQuery(String queryText, String field) {
        List<Query> prefixQueries = tokenize(queryText).stream()
                .map(QueryUtil::reverse)
                .map(reversed -> Query.of(q -> q.prefix(p -> p.field(field).value(reversed))))
                .toList();

        if (prefixQueries.isEmpty()) {
            return Query.of(q -> q.matchNone(mn -> mn));
        }

        return Query.of(q -> q.bool(b -> b.must(prefixQueries)));
    }

    public static Query buildDisMaxQuery(List<Query> queries, Double tieBreaker) {
        return Query.of(q -> q
                .disMax(dm -> dm
                        .tieBreaker(tieBreaker)
                        .queries(queries)
                )
        );
    }

    public static Query buildCodeQuery(String code, String field) {
        return Query.of(q -> q.term(t -> t.field(field).value(code)));
    }

    public static List<String> tokenize(String queryText) {
        return TOKEN.matcher(queryText.toLowerCase(Locale.ROOT)).results()
                .map(MatchResult::group)
                .toList();
    }

    private static String reverse(String token) {
        return new StringBuilder(token).reverse().toString();
    }
}
