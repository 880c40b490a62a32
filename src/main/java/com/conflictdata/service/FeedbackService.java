package com.conflictdata.service;

import com.conflictdata.exception.InvalidRequestException;
import com.conflictdata.exception.ResourceNotFoundException;
import com.conflictdata.model.ConflictRecord;
import com.conflictdata.model.Feedback;
import com.conflictdata.model.User;
import com.conflictdata.repository.ConflictRecordRepository;
import com.conflictdata.repository.FeedbackRepository;
import com.conflictdata.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    @Autowired
    private FeedbackRepository feedbackRepository;

    @Autowired
    private ConflictRecordRepository conflictRecordRepository;

    @Autowired
    private UserRepository userRepository;

    @Value("${conflictdata.feedback.min-length:20}")
    private int minLength;

    @Value("${conflictdata.feedback.max-length:600}")
    private int maxLength;

    @Transactional
    public Feedback submit(Long userId, String region, String text) {
        int length = text == null ? 0 : text.codePointCount(0, text.length());
        if (text == null || length < minLength || length > maxLength) {
            throw new InvalidRequestException(
                "Invalid request: feedback must be " + minLength + "-" + maxLength + " characters");
        }

        ConflictRecord record = conflictRecordRepository.findFirstByRegionOrderByIdAsc(region)
            .orElseThrow(() -> new ResourceNotFoundException("Admin1 region not found: " + region));
        User author = userRepository.findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        Feedback feedback = new Feedback();
        feedback.setAuthor(author);
        feedback.setConflictRecord(record);
        feedback.setCountry(record.getCountry());
        feedback.setRegion(region);
        feedback.setText(text);

        Feedback saved = feedbackRepository.save(feedback);
        log.info("User {} left feedback {} on {}/{}", userId, saved.getId(), record.getCountry(), region);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Feedback> listForRegion(String region) {
        if (!conflictRecordRepository.existsByRegion(region)) {
            throw new ResourceNotFoundException("Admin1 region not found: " + region);
        }
        return feedbackRepository.findByRegionNewestFirst(region);
    }
}
