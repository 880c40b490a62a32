package com.conflictdata.security;

import com.conflictdata.exception.InvalidCredentialsException;
import com.conflictdata.exception.InvalidRequestException;
import com.conflictdata.exception.UsernameTakenException;
import com.conflictdata.model.User;
import com.conflictdata.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    public User register(String username, String password) {
        if (userRepository.existsByUsername(username)) {
            throw new UsernameTakenException(username);
        }

        PasswordPolicy.Result check = PasswordPolicy.validate(password);
        if (!check.valid()) {
            throw new InvalidRequestException(check.message());
        }

        User user = new User();
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(password));
        try {
            // flush here so a concurrent registration surfaces as a unique violation now
            User saved = userRepository.saveAndFlush(user);
            log.info("Registered user {} (id={})", username, saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new UsernameTakenException(username);
        }
    }

    /**
     * @return a signed access token for the user
     */
    @Transactional(readOnly = true)
    public String login(String username, String password) {
        User user = userRepository.findByUsername(username)
            .orElseThrow(InvalidCredentialsException::new);

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.info("Failed login for {}", username);
            throw new InvalidCredentialsException();
        }
        return jwtTokenProvider.generateToken(user);
    }
}
