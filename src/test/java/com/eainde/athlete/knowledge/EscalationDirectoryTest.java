package com.eainde.athlete.knowledge;

import com.eainde.athlete.state.TopicDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationDirectoryTest {

    private final EscalationDirectory directory = new EscalationDirectory();

    @Test
    @DisplayName("safety and doping matters go to their independent authorities")
    void primaryTargets() {
        assertThat(directory.primaryFor(TopicDomain.SAFESPORT).id()).isEqualTo(EscalationDirectory.SAFESPORT_CENTER);
        assertThat(directory.primaryFor(TopicDomain.ATHLETE_SAFETY).id())
                .isEqualTo(EscalationDirectory.SAFESPORT_CENTER);
        assertThat(directory.primaryFor(TopicDomain.ANTI_DOPING).id()).isEqualTo(EscalationDirectory.USADA);
        assertThat(directory.primaryFor(TopicDomain.TEAM_SELECTION).id())
                .isEqualTo(EscalationDirectory.ATHLETE_OMBUDS);
    }

    @Test
    @DisplayName("an unresolved domain is treated as a safety matter")
    void unresolved() {
        assertThat(directory.primaryFor(null).id()).isEqualTo(EscalationDirectory.SAFESPORT_CENTER);
    }

    @ParameterizedTest
    @EnumSource(TopicDomain.class)
    @DisplayName("every domain lists its primary first and never the emergency line")
    void allFor(TopicDomain domain) {
        assertThat(directory.allFor(domain)).first().isEqualTo(directory.primaryFor(domain));
        assertThat(directory.allFor(domain)).extracting(EscalationTarget::id)
                .doesNotContain(EscalationDirectory.EMERGENCY_SERVICES)
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("contact blocks lead with the phone number when there is one")
    void contactBlock() {
        EscalationTarget usada = directory.get(EscalationDirectory.USADA).orElseThrow();

        assertThat(usada.primaryContact()).isEqualTo("1-866-601-2632");
        assertThat(usada.contactBlock()).contains("**U.S. Anti-Doping Agency (USADA)**", "- Phone: 1-866-601-2632");
    }
}
