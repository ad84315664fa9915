package com.caffe.emergency.service.directory;

import com.caffe.emergency.model.User;
import com.caffe.emergency.model.UserRole;
import com.caffe.emergency.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    public List<User> usersByRole(UserRole role) {
        return userRepository.findByRoleAndActiveTrue(role);
    }

    @Override
    public List<User> usersByParish(String parish) {
        return userRepository.findByParishIgnoreCaseAndActiveTrue(parish);
    }
}
