package com.caffe.emergency.service.directory;

import com.caffe.emergency.model.User;
import com.caffe.emergency.model.UserRole;

import java.util.List;

/**
 * Lookup of active users for dynamic recipient targeting.
 */
public interface UserDirectory {

    List<User> usersByRole(UserRole role);

    List<User> usersByParish(String parish);
}
