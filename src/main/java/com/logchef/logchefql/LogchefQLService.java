package com.logchef.logchefql;

import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.Node;
import com.logchef.logchefql.ast.QueryNode;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for LogchefQL: validation, translation to ClickHouse SQL and LogsQL,
 * and the UI metadata derived from a query.
 *
 * Errors are reported as data on the result objects. The lexer runs first, then the
 * parser (which checks for missing boolean operators before parsing); the first error
 * found wins and no output is generated for an invalid query.
 */
@Component
public class LogchefQLService {

    private static final Logger logger = LoggerFactory.getLogger(LogchefQLService.class);

    private final QueryLexer lexer = new QueryLexer();
    private final QueryParser parser = new QueryParser();
    private final ClickHouseSqlGenerator sqlGenerator;
    private final LogsQLGenerator logsQLGenerator;
    private final MetadataExtractor metadataExtractor;
    private final TranslationMetrics metrics;

    @Autowired
    public LogchefQLService(ClickHouseSqlGenerator sqlGenerator,
                            LogsQLGenerator logsQLGenerator,
                            MetadataExtractor metadataExtractor,
                            TranslationMetrics metrics) {
        this.sqlGenerator = sqlGenerator;
        this.logsQLGenerator = logsQLGenerator;
        this.metadataExtractor = metadataExtractor;
        this.metrics = metrics;
    }

    /**
     * Translate a query into a ClickHouse WHERE-clause condition
     *
     * @param query  LogchefQL text, empty or blank means "no filter"
     * @param schema table schema used for nested field access, may be null
     */
    public TranslateResult translate(String query, Schema schema) {
        return translate(query, schema, null);
    }

    /**
     * Same as {@link #translate(String, Schema)}, with the timestamp column placed first
     * in the select clause of a pipe projection
     */
    public TranslateResult translate(String query, Schema schema, String timestampField) {
        if (isBlank(query)) {
            return TranslateResult.empty();
        }

        Timer.Sample sample = metrics.startTranslationTimer();
        try {
            metrics.recordTranslation();
            Analysis analysis = analyze(query);
            if (analysis.error != null) {
                metrics.recordFailure(analysis.error.getCode());
                return TranslateResult.failure(analysis.error);
            }

            String sql = sqlGenerator.generate(analysis.ast, schema);
            String selectClause = null;
            List<FieldPath> select = selectFields(analysis.ast);
            if (!select.isEmpty()) {
                selectClause = sqlGenerator.generateSelectClause(select, schema, timestampField);
            }
            return TranslateResult.success(sql, selectClause,
                    metadataExtractor.extractConditions(analysis.tokens),
                    metadataExtractor.extractFieldsUsed(analysis.tokens));
        } finally {
            metrics.recordTranslationLatency(sample);
        }
    }

    /**
     * Translate a query into a VictoriaLogs LogsQL filter. The schema is accepted for
     * symmetry with {@link #translate(String, Schema)}; LogsQL addresses nested fields
     * natively and does not need it.
     */
    public LogsQLTranslateResult translateToLogsQL(String query, Schema schema) {
        if (isBlank(query)) {
            return LogsQLTranslateResult.empty();
        }

        Timer.Sample sample = metrics.startTranslationTimer();
        try {
            metrics.recordTranslation();
            Analysis analysis = analyze(query);
            if (analysis.error != null) {
                metrics.recordFailure(analysis.error.getCode());
                return LogsQLTranslateResult.failure(analysis.error);
            }

            String logsql = logsQLGenerator.generate(analysis.ast);
            String selectClause = null;
            List<FieldPath> select = selectFields(analysis.ast);
            if (!select.isEmpty()) {
                selectClause = logsQLGenerator.generateSelectClause(select);
            }
            return LogsQLTranslateResult.success(logsql, selectClause,
                    metadataExtractor.extractConditions(analysis.tokens),
                    metadataExtractor.extractFieldsUsed(analysis.tokens));
        } finally {
            metrics.recordTranslationLatency(sample);
        }
    }

    public ValidateResult validate(String query) {
        if (isBlank(query)) {
            return ValidateResult.valid();
        }
        Analysis analysis = analyze(query);
        return analysis.error == null ? ValidateResult.valid() : ValidateResult.invalid(analysis.error);
    }

    /**
     * Conditions of a valid query, for the field sidebar. Invalid queries yield an empty list.
     */
    public List<FilterCondition> getConditions(String query) {
        if (isBlank(query)) {
            return List.of();
        }
        Analysis analysis = analyze(query);
        if (analysis.error != null) {
            return List.of();
        }
        return metadataExtractor.extractConditions(analysis.tokens);
    }

    private Analysis analyze(String query) {
        TokenizeResult tokenized = lexer.tokenize(query);
        if (tokenized.hasErrors()) {
            ParseError error = tokenized.getErrors().get(0);
            logger.debug("Rejected LogchefQL query at lexing: {}", error);
            return new Analysis(tokenized.getTokens(), null, error);
        }

        ParseResult parsed = parser.parse(tokenized.getTokens());
        if (!parsed.isSuccess()) {
            ParseError error = parsed.getErrors().get(0);
            logger.debug("Rejected LogchefQL query at parsing: {}", error);
            return new Analysis(tokenized.getTokens(), null, error);
        }
        return new Analysis(tokenized.getTokens(), parsed.getAst().orElse(null), null);
    }

    private static List<FieldPath> selectFields(Node ast) {
        if (ast instanceof QueryNode) {
            return ((QueryNode) ast).getSelect();
        }
        return List.of();
    }

    private static boolean isBlank(String query) {
        return query == null || query.isBlank();
    }

    /**
     * Tokens and AST of one query, or the first error that stopped it
     */
    private static final class Analysis {
        private final List<Token> tokens;
        private final Node ast;
        private final ParseError error;

        private Analysis(List<Token> tokens, Node ast, ParseError error) {
            this.tokens = tokens;
            this.ast = ast;
            this.error = error;
        }
    }
}
