package com.carrental.repository;

import com.carrental.model.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByUsername(String username);
    Optional<User> findByUsernameIgnoreCase(String username);
    boolean existsByUsernameIgnoreCase(String username);

    List<User> findByRoleOrderByCreatedAtDesc(String role);
    List<User> findByRoleInOrderByCreatedAtDesc(Collection<String> roles);
    List<User> findAllByOrderByCreatedAtDesc();

    long countByRole(String role);
}
