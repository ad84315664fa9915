package com.caffe.emergency.repository;

import com.caffe.emergency.model.User;
import com.caffe.emergency.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserRepository extends JpaRepository<User, Long> {

    List<User> findByRoleAndActiveTrue(UserRole role);

    List<User> findByParishIgnoreCaseAndActiveTrue(String parish);
}
