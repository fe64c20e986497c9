package com.taskbot.repository;

import com.taskbot.domain.model.User;
import com.taskbot.util.CommandNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class UserRepositoryTest {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void localFormatPhoneMatchesInternationalSender() {
        User user = user("Ali", "Khan", "ali@acme.test", "acme");
        user.setPhone("03001111111");
        entityManager.persistAndFlush(user);
        List<String> variants = CommandNormalizer.addressVariants(CommandNormalizer.senderKey("whatsapp:+923001111111"));

        assertThat(userRepository.findFirstByWhatsappNumberInOrPhoneIn(variants, variants))
                .get()
                .extracting(User::getFirstName)
                .isEqualTo("Ali");
    }

    @Test
    void assigneeCandidatesPreferExactEmailAndStayInOrganization() {
        entityManager.persist(user("Sara", "Ahmed", "sara.ahmed@acme.test", "acme"));
        entityManager.persist(user("Zain", "Raza", "ahmed@acme.test", "acme"));
        entityManager.persist(user("Ahmed", "Ali", "ahmed@globex.test", "globex"));
        User inactive = user("Ahmed", "Old", "old@acme.test", "acme");
        inactive.setActive(false);
        entityManager.persist(inactive);
        entityManager.flush();

        List<User> byEmail = userRepository.findAssigneeCandidates("acme", "ahmed@acme.test");
        List<User> byName = userRepository.findAssigneeCandidates("acme", "ahmed");

        assertThat(byEmail).extracting(User::getEmail).containsExactly("ahmed@acme.test", "sara.ahmed@acme.test");
        assertThat(byName).extracting(User::getEmail).containsExactly("sara.ahmed@acme.test", "ahmed@acme.test");
    }

    @Test
    void digestRecipientsAreActiveAndOptedIn() {
        entityManager.persist(user("Ali", null, "ali@acme.test", "acme"));
        User optedOut = user("Sara", null, "sara@acme.test", "acme");
        optedOut.setDailyDigestEnabled(false);
        entityManager.persist(optedOut);
        User inactive = user("Omar", null, "omar@acme.test", "acme");
        inactive.setActive(false);
        entityManager.persist(inactive);
        entityManager.flush();

        assertThat(userRepository.findByActiveTrueAndDailyDigestEnabledTrue())
                .extracting(User::getFirstName)
                .containsExactly("Ali");
    }

    private static User user(String firstName, String lastName, String email, String organizationId) {
        User user = new User();
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setEmail(email);
        user.setOrganizationId(organizationId);
        return user;
    }
}
