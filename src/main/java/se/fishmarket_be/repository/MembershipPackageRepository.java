package se.fishmarket_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.fishmarket_be.pojo.MembershipPackage;

import java.util.List;
import java.util.Optional;

public interface MembershipPackageRepository extends JpaRepository<MembershipPackage, Long> {
    List<MembershipPackage> findByIsActiveTrueOrderByPriceAsc();

    Optional<MembershipPackage> findByPackageIdAndIsActiveTrue(Long packageId);
}
