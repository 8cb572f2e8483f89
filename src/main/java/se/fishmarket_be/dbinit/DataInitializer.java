package se.fishmarket_be.dbinit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import se.fishmarket_be.pojo.Category;
import se.fishmarket_be.pojo.MembershipPackage;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.repository.CategoryRepository;
import se.fishmarket_be.repository.MembershipPackageRepository;
import se.fishmarket_be.repository.UserRepository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds an admin account, the fish categories and the membership packages on an empty database.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final MembershipPackageRepository membershipPackageRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.seed.admin-email:admin@fishmarket.local}")
    private String adminEmail;

    @Value("${app.seed.admin-password:admin12345}")
    private String adminPassword;

    public DataInitializer(UserRepository userRepository,
                           CategoryRepository categoryRepository,
                           MembershipPackageRepository membershipPackageRepository,
                           PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.categoryRepository = categoryRepository;
        this.membershipPackageRepository = membershipPackageRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(String... args) {
        initAdmin();
        initCategories();
        initMembershipPackages();
    }

    private void initAdmin() {
        if (userRepository.count() > 0) {
            return;
        }
        userRepository.save(User.builder()
                .email(adminEmail.trim().toLowerCase())
                .passwordHash(passwordEncoder.encode(adminPassword))
                .fullName("Administrator")
                .isAdmin(true)
                .isActive(true)
                .boostCredits(0)
                .build());
        log.info("Default admin account {} has been created", adminEmail);
    }

    private void initCategories() {
        if (categoryRepository.count() > 0) {
            return;
        }
        List<Category> categories = new ArrayList<>();
        categories.add(category("Freshwater Fish", "Carp, tilapia, catfish and other freshwater species"));
        categories.add(category("Saltwater Fish", "Marine fish from coastal and deep-sea catches"));
        categories.add(category("Ornamental Fish", "Koi, goldfish, betta and aquarium species"));
        categories.add(category("Fry & Fingerlings", "Juvenile stock for ponds and farms"));
        categories.add(category("Shellfish & Crustaceans", "Shrimp, crab, lobster and mussels"));
        categories.add(category("Equipment & Feed", "Aquarium gear, pond equipment and fish feed"));
        categoryRepository.saveAll(categories);
        log.info("{} default categories have been created", categories.size());
    }

    private void initMembershipPackages() {
        if (membershipPackageRepository.count() > 0) {
            return;
        }
        List<MembershipPackage> packages = new ArrayList<>();
        packages.add(membershipPackage("Basic", "For occasional sellers", "49000.00", 30, 10, 2,
                List.of("Up to 10 active ads", "2 boost credits")));
        packages.add(membershipPackage("Pro", "For regular traders", "149000.00", 30, 50, 10,
                List.of("Up to 50 active ads", "10 boost credits", "Priority moderation")));
        packages.add(membershipPackage("Farm", "For fish farms and wholesalers", "399000.00", 90, 200, 40,
                List.of("Up to 200 active ads", "40 boost credits", "Priority moderation", "Seller badge")));
        membershipPackageRepository.saveAll(packages);
        log.info("{} default membership packages have been created", packages.size());
    }

    private static Category category(String name, String description) {
        return Category.builder()
                .name(name)
                .description(description)
                .isActive(true)
                .build();
    }

    private static MembershipPackage membershipPackage(String name, String description, String price,
                                                       int durationDays, int maxAds, int boostCredits,
                                                       List<String> features) {
        return MembershipPackage.builder()
                .name(name)
                .description(description)
                .price(new BigDecimal(price))
                .durationDays(durationDays)
                .maxAds(maxAds)
                .boostCredits(boostCredits)
                .features(new ArrayList<>(features))
                .isActive(true)
                .build();
    }
}
