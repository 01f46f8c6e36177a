package com.example.acl.authz.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Permission")
class PermissionTest {

    @Nested
    @DisplayName("bitmask")
    class Bitmask {

        @Test
        @DisplayName("should combine permissions additively")
        void shouldCombineAdditively() {
            assertThat(Permission.mask(Permission.READ, Permission.WRITE)).isEqualTo(6);
            assertThat(Permission.mask(Permission.READ, Permission.WRITE, Permission.MODIFY)).isEqualTo(Permission.ALL);
            assertThat(Permission.mask()).isEqualTo(Permission.NONE);
        }

        @Test
        @DisplayName("should decode a mask into its permissions")
        void shouldDecode() {
            assertThat(Permission.decode(5)).isEqualTo(EnumSet.of(Permission.READ, Permission.MODIFY));
            assertThat(Permission.decode(0)).isEmpty();
        }

        @Test
        @DisplayName("should test individual bits")
        void shouldTestBits() {
            assertThat(Permission.READ.isGrantedBy(6)).isTrue();
            assertThat(Permission.MODIFY.isGrantedBy(6)).isFalse();
            assertThat(Permission.WRITE.isGrantedBy(0)).isFalse();
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 8, 42})
        @DisplayName("should reject values outside 0..7")
        void shouldRejectOutOfRange(int mask) {
            assertThatThrownBy(() -> Permission.validate(mask))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("rules and groups")
    class RulesAndGroups {

        @Test
        @DisplayName("should reject a rule with an invalid permission")
        void shouldRejectInvalidRule() {
            assertThatThrownBy(() -> new AclRule("name", 9))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should allow an explicit no-access rule")
        void shouldAllowZeroRule() {
            AclRule rule = new AclRule("name", 0);

            assertThat(rule.grants(Permission.READ)).isFalse();
        }

        @Test
        @DisplayName("should replace an earlier rule on the same predicate")
        void shouldReplaceRuleOnSamePredicate() {
            AclGroup group = AclGroup.named("dev")
                    .withRule(AclRule.of("name", Permission.READ))
                    .withRule(AclRule.of("age", Permission.READ))
                    .withRule(AclRule.of("name", Permission.WRITE));

            assertThat(group.rules()).hasSize(2);
            assertThat(group.ruleFor("name")).map(AclRule::permission).contains(Permission.WRITE.code());
        }

        @Test
        @DisplayName("should remove a rule")
        void shouldRemoveRule() {
            AclGroup group = AclGroup.named("dev")
                    .withRule(AclRule.of("name", Permission.READ))
                    .withoutRule("name");

            assertThat(group.rules()).isEmpty();
        }
    }
}
