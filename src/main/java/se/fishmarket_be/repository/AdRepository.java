package se.fishmarket_be.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.fishmarket_be.pojo.Ad;

import java.util.List;
import java.util.Optional;

public interface AdRepository extends JpaRepository<Ad, Long>, JpaSpecificationExecutor<Ad> {

    List<Ad> findByUserUserIdOrderByCreatedAtDesc(Long userId);

    Optional<Ad> findByAdIdAndUserUserId(Long adId, Long userId);

    @Query("SELECT a FROM Ad a LEFT JOIN FETCH a.category LEFT JOIN FETCH a.user WHERE a.adId = :adId")
    Optional<Ad> findByIdWithRelations(@Param("adId") Long adId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Ad a WHERE a.adId = :adId")
    Optional<Ad> findByIdForUpdate(@Param("adId") Long adId);

    // Deleted ads are not readable and do not collect views
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Ad a SET a.viewCount = a.viewCount + 1 " +
           "WHERE a.adId = :adId AND a.status <> se.fishmarket_be.pojo.enums.AdStatus.DELETED")
    int incrementViewCount(@Param("adId") Long adId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Ad a SET a.contactCount = a.contactCount + 1 WHERE a.adId = :adId")
    int incrementContactCount(@Param("adId") Long adId);
}
