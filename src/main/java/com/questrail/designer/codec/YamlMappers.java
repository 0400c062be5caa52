package com.questrail.designer.codec;

import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

import java.util.regex.Pattern;

/**
 * Shared YAML mapper configuration for the configuration codec.
 *
 * Output has no document start marker, two-space indentation with sequence
 * indicators, and quotes only where the text would otherwise be read back as a
 * different scalar type. Phone numbers such as {@code +15551234567} and
 * addresses such as {@code 10.0.0.5} therefore stay strings.
 */
final class YamlMappers
{
    private YamlMappers() {}

    static YAMLMapper create() {
        YAMLFactory factory = YAMLFactory.builder()
                .stringQuotingChecker(new NumericLookingQuoter())
                .build();
        return YAMLMapper.builder(factory)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .build();
    }

    /**
     * Also quotes any string a YAML 1.1 reader could resolve as a number,
     * including signed values and the special floats.
     */
    static final class NumericLookingQuoter extends StringQuotingChecker.Default
    {
        private static final long serialVersionUID = 1L;

        private static final Pattern NUMERIC_LOOKING =
                Pattern.compile("^[-+]?(\\.?[0-9].*|\\.(inf|nan))$", Pattern.CASE_INSENSITIVE);

        @Override
        public boolean needToQuoteValue(String value) {
            return super.needToQuoteValue(value) || NUMERIC_LOOKING.matcher(value).matches();
        }
    }
}
