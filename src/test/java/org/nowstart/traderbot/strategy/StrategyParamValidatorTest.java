package org.nowstart.traderbot.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.traderbot.data.exception.InvalidParametersException;
import org.nowstart.traderbot.data.type.OptionType;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.nowstart.traderbot.strategy.ma.MovingAverageCrossoverDefinition;
import org.nowstart.traderbot.strategy.rsi.RsiThresholdDefinition;

class StrategyParamValidatorTest {

    private final StrategyParamValidator validator = new StrategyParamValidator();

    @Test
    void resolve_appliesDefaultsForMissingOptions() {
        StrategyParams params = validator.resolve(new MovingAverageCrossoverDefinition(), null);

        assertThat(params.getInt("fast_period")).isEqualTo(20);
        assertThat(params.getInt("slow_period")).isEqualTo(50);
    }

    @Test
    void resolve_convertsTextualNumbers() {
        StrategyParams params = validator.resolve(
                new RsiThresholdDefinition(),
                Map.of("rsi_period", "7", "oversold", 25, "overbought", 80.5)
        );

        assertThat(params.getInt("rsi_period")).isEqualTo(7);
        assertThat(params.getDecimal("oversold")).isEqualByComparingTo("25");
        assertThat(params.getDecimal("overbought")).isEqualByComparingTo("80.5");
    }

    @Test
    void resolve_collectsEveryViolation() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("rsi_period", 1);
        raw.put("oversold", "abc");
        raw.put("overbought", "101");
        raw.put("window", 3);

        InvalidParametersException exception = catchThrowableOfType(
                () -> validator.resolve(new RsiThresholdDefinition(), raw),
                InvalidParametersException.class
        );

        assertThat(exception.getCode()).isEqualTo("invalid_parameters");
        assertThat(exception.getViolations()).containsExactly(
                "unknown option window",
                "rsi_period must be >= 2 but was 1",
                "oversold must be of type DECIMAL but was abc",
                "overbought must be <= 100 but was 101"
        );
    }

    @Test
    void resolve_rejectsFractionalInteger() {
        InvalidParametersException exception = catchThrowableOfType(
                () -> validator.resolve(new MovingAverageCrossoverDefinition(), Map.of("fast_period", 2.5)),
                InvalidParametersException.class
        );

        assertThat(exception.getViolations()).containsExactly("fast_period must be of type INTEGER but was 2.5");
    }

    @Test
    void resolve_skipsCrossFieldRulesWhileOptionsAreInvalid() {
        InvalidParametersException exception = catchThrowableOfType(
                () -> validator.resolve(new MovingAverageCrossoverDefinition(), Map.of("fast_period", 0, "slow_period", 10)),
                InvalidParametersException.class
        );

        assertThat(exception.getViolations()).containsExactly("fast_period must be >= 1 but was 0");
    }

    @Test
    void resolve_reportsMissingRequiredOption() {
        StrategyDefinition definition = new StrategyDefinition() {
            @Override
            public String name() {
                return "needs_flag";
            }

            @Override
            public String description() {
                return "test";
            }

            @Override
            public List<StrategyOption> options() {
                return List.of(
                        new StrategyOption("flag", OptionType.BOOLEAN, null, null, null, "required flag"),
                        new StrategyOption("label", OptionType.STRING, "x", null, null, "label")
                );
            }

            @Override
            public TradingStrategy newInstance() {
                throw new UnsupportedOperationException();
            }
        };

        InvalidParametersException exception = catchThrowableOfType(
                () -> validator.resolve(definition, Map.of("label", "y")),
                InvalidParametersException.class
        );
        StrategyParams resolved = validator.resolve(definition, Map.of("flag", "TRUE"));

        assertThat(exception.getViolations()).containsExactly("flag is required");
        assertThat(resolved.getBoolean("flag")).isTrue();
        assertThat(resolved.getString("label")).isEqualTo("x");
        assertThat(resolved.asMap()).containsEntry("flag", Boolean.TRUE);
    }
}
