package se.fishmarket_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.fishmarket_be.pojo.Category;

import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {
    List<Category> findByIsActiveTrueOrderByNameAsc();
}
