package dev.shortcuts.engine;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.ErrorKind;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Permission;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.model.ValidationError;
import dev.shortcuts.model.ValidationLimits;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dev.shortcuts.Fixtures.action;
import static dev.shortcuts.Fixtures.conditional;
import static dev.shortcuts.Fixtures.registry;
import static dev.shortcuts.Fixtures.shortcut;
import static org.assertj.core.api.Assertions.assertThat;

class ShortcutValidatorTest {

    private final ShortcutValidator validator = new ShortcutValidator(registry());

    @Test
    void acceptsNotificationShortcut() {
        Shortcut morning = shortcut("Good Morning",
            action("notification", "title", "Hi", "body", "Morning", "sound", true));

        ValidationResult result = validator.validate(morning);

        assertThat(result).isInstanceOf(ValidationResult.Accepted.class);
        assertThat(result.errors()).isEmpty();
        assertThat(result.permissions()).containsExactly(Permission.NOTIFICATION);
    }

    @Test
    void fiftyOneActionsYieldExactlyOneLimitError() {
        var actions = new ArrayList<Action>();
        for (int i = 0; i < 51; i++) {
            actions.add(i % 2 == 0 ? action("not_a_real_action") : action("text", "text", "t" + i));
        }

        ValidationResult result = validator.validate(new Shortcut("Too long", actions));

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).kind()).isEqualTo(ErrorKind.LIMIT);
        assertThat(result.errors().get(0).message()).contains("51").contains("50");
    }

    @Test
    void fiftyActionsAreWithinTheLimit() {
        var actions = new ArrayList<Action>();
        for (int i = 0; i < 50; i++) {
            actions.add(action("wait", "seconds", 1));
        }

        assertThat(validator.validate(new Shortcut("Exactly fifty", actions)).isAccepted()).isTrue();
    }

    @Test
    void unknownTypeIsReportedAtItsIndex() {
        Shortcut shortcut = shortcut("Unknown",
            action("text", "text", "a"),
            action("text", "text", "b"),
            action("not_a_real_action"));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).kind()).isEqualTo(ErrorKind.INVALID_ACTION);
        assertThat(errors.get(0).actionIndex()).isEqualTo(2);
        assertThat(errors.get(0).message()).contains("not_a_real_action");
    }

    @Test
    void unknownTypeMessageSuggestsSimilarActions() {
        Shortcut shortcut = shortcut("Typo", action("take_photograph"));

        ValidationError error = validator.validate(shortcut).errors().get(0);

        assertThat(error.message()).contains("Similar actions:").contains("take_photo");
    }

    @Test
    void reportsMissingAndUnknownParameters() {
        Shortcut shortcut = shortcut("Params", action("notification", "title", "Hi", "colour", "red"));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).extracting(ValidationError::kind).containsOnly(ErrorKind.PARAMETER);
        assertThat(errors).extracting(ValidationError::message).containsExactly(
            "Unknown parameter 'colour' for action 'notification'",
            "Missing required parameter 'body' for action 'notification'");
    }

    @Test
    void rejectsValuesThatCannotBeCoerced() {
        Shortcut shortcut = shortcut("Bad types",
            action("wait", "seconds", "soon"),
            action("take_photo", "useFrontCamera", 3));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(2);
        assertThat(errors.get(0).message()).contains("'seconds'").contains("expected number");
        assertThat(errors.get(1).message()).contains("'useFrontCamera'").contains("expected boolean, got number");
    }

    @Test
    void sanitizesParameterValues() {
        Shortcut shortcut = shortcut("Sanitize",
            action("text", "text", "  padded  "),
            action("wait", "seconds", " 2.456 "),
            action("set_volume", "level", new BigDecimal("33.333")),
            action("take_photo", "useFrontCamera", "TRUE"),
            action("ask", "prompt", "Age?", "defaultValue", 42));

        var accepted = (ValidationResult.Accepted) validator.validate(shortcut);
        List<Action> actions = accepted.shortcut().actions();

        assertThat(actions.get(0).parameter("text")).contains(ParameterValue.text("padded"));
        assertThat(actions.get(1).parameter("seconds")).contains(new ParameterValue.Number(new BigDecimal("2.46")));
        assertThat(actions.get(2).parameter("level")).contains(new ParameterValue.Number(new BigDecimal("33.33")));
        assertThat(actions.get(3).parameter("useFrontCamera")).contains(ParameterValue.bool(true));
        assertThat(actions.get(4).parameter("defaultValue")).contains(ParameterValue.text("42"));
    }

    @Test
    void nullParametersTakeTheSchemaDefault() {
        Action sound = new Action("play_sound",
            Map.of("sound", new ParameterValue.Opaque(null)));

        var accepted = (ValidationResult.Accepted) validator.validate(shortcut("Defaults", sound));

        assertThat(accepted.shortcut().actions().get(0).parameter("sound")).contains(ParameterValue.text("default"));
    }

    @Test
    void roundsHalfUpToTwoPlaces() {
        assertThat(ShortcutValidator.round(new BigDecimal("1.005"))).isEqualByComparingTo("1.01");
        assertThat(ShortcutValidator.round(new BigDecimal("2.50"))).isEqualTo(new BigDecimal("2.5"));
        assertThat(ShortcutValidator.round(new BigDecimal("100"))).isEqualTo(new BigDecimal("100"));
        assertThat(ShortcutValidator.round(new BigDecimal("-0.004"))).isEqualByComparingTo("0");
    }

    @Test
    void oversizedNumbersAreReportedInsteadOfRounded() {
        Shortcut shortcut = shortcut("Huge",
            action("wait", "seconds", "1e999999999"),
            new Action("wait", Map.of("seconds", new ParameterValue.Number(new BigDecimal("1e999999999")))));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(2)
            .allSatisfy(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.PARAMETER);
                assertThat(error.message()).contains("invalid type", "number out of range");
            });
    }

    @Test
    void tinyNumbersRoundToZero() {
        assertThat(ShortcutValidator.round(new BigDecimal("1e-999999999"))).isEqualByComparingTo("0");
    }

    @Test
    void nestedErrorsCarryTheirBranchPath() {
        Shortcut shortcut = shortcut("Nested",
            conditional("{answer} is yes",
                List.of(action("text", "text", "ok"), action("bogus")),
                List.of()));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(1);
        ValidationError error = errors.get(0);
        assertThat(error.kind()).isEqualTo(ErrorKind.NESTED);
        assertThat(error.path()).containsExactly("if:0", "then");
        assertThat(error.message()).startsWith("if:0 > then: Unknown action type 'bogus' at index 1");
        assertThat(error.actionIndex()).isEqualTo(1);
        assertThat(error.innermost().kind()).isEqualTo(ErrorKind.INVALID_ACTION);
    }

    @Test
    void limitInsideANestedListIsWrapped() {
        var body = new ArrayList<Action>();
        for (int i = 0; i < 51; i++) {
            body.add(action("wait", "seconds", 1));
        }
        Shortcut shortcut = shortcut("Big loop", action("repeat", "count", 2, "actions", body));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).kind()).isEqualTo(ErrorKind.NESTED);
        assertThat(errors.get(0).innermost().kind()).isEqualTo(ErrorKind.LIMIT);
        assertThat(errors.get(0).path()).containsExactly("repeat:0", "actions");
    }

    @Test
    void repeatedAncestorTokenIsCircular() {
        Shortcut shortcut = shortcut("Loop back",
            conditional("a", List.of(conditional("b", List.of(action("text", "text", "x")), null)), null));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).innermost().kind()).isEqualTo(ErrorKind.CIRCULAR);
        assertThat(errors.get(0).innermost().message()).contains("if:0");
    }

    @Test
    void nestingDeeperThanTheLimitIsReported() {
        var shallow = new ShortcutValidator(registry(), ValidationLimits.defaults().withMaxNestingDepth(1));
        Shortcut shortcut = shortcut("Deep",
            conditional("outer", List.of(
                action("text", "text", "first"),
                conditional("inner", List.of(action("text", "text", "too deep")), null)), null));

        List<ValidationError> errors = shallow.validate(shortcut).errors();

        assertThat(errors).extracting(e -> e.innermost().kind()).containsExactly(ErrorKind.LIMIT);
        assertThat(errors.get(0).path()).containsExactly("if:0", "then", "if:1", "then");
    }

    @Test
    void rejectsMalformedRoot() {
        assertThat(validator.validate(new Shortcut(" ", List.of())).errors())
            .extracting(ValidationError::kind).containsExactly(ErrorKind.STRUCTURE);
        assertThat(validator.validate(new Shortcut("x".repeat(256), List.of())).errors().get(0).message())
            .contains("too long");
        assertThat(validator.validate(new Shortcut("No list", null)).errors())
            .extracting(ValidationError::message).containsExactly("Shortcut actions must be a list");
        assertThat(validator.validate(shortcut("Typeless", new Action(null, Map.of()))).errors().get(0).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void collectsEveryErrorInOnePass() {
        Shortcut shortcut = new Shortcut("", List.of(
            action("nope"),
            action("url"),
            conditional("c", List.of(action("wait", "seconds", "later")), List.of(action("also_nope")))));

        List<ValidationError> errors = validator.validate(shortcut).errors();

        assertThat(errors).extracting(e -> e.innermost().kind()).containsExactly(
            ErrorKind.STRUCTURE, ErrorKind.INVALID_ACTION, ErrorKind.PARAMETER,
            ErrorKind.PARAMETER, ErrorKind.INVALID_ACTION);
    }

    @Test
    void validationIsIdempotent() {
        Shortcut shortcut = shortcut("Twice",
            action("ask", "prompt", " What is your name? "),
            conditional("{name} is set",
                List.of(action("notification", "body", "Hello {name}", "sound", "false")),
                List.of(action("repeat", "count", "2.499", "actions", List.of(action("wait", "seconds", 1))))));

        var first = (ValidationResult.Accepted) validator.validate(shortcut);
        ValidationResult second = validator.validate(first.shortcut());

        assertThat(second).isInstanceOf(ValidationResult.Accepted.class);
        assertThat(((ValidationResult.Accepted) second).shortcut()).isEqualTo(first.shortcut());
    }

    @Test
    void permissionsAreListedAsTrailingIssue() {
        Shortcut shortcut = shortcut("Perms",
            action("get_location"),
            action("take_photo"),
            action("bogus"));

        ValidationResult result = validator.validate(shortcut);

        assertThat(result.errors()).hasSize(1);
        List<ValidationError> issues = result.issues();
        assertThat(issues).hasSize(2);
        assertThat(issues.get(1).kind()).isEqualTo(ErrorKind.PERMISSIONS);
        assertThat(issues.get(1).message()).isEqualTo("Required permissions: camera, location");
    }
}
