package com.radioautomation.intake.store;

import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.repository.QueuedFileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class QueuedFileAtomicService {

    private final QueuedFileRepository queuedFileRepository;

    /**
     * Attempts to create a new QueuedFile record in its own new transaction.
     * It will throw a DataIntegrityViolationException if a concurrent scan already inserted the same
     * show and filename, which the caller must handle.
     *
     * @param potentialNewFile The new QueuedFile to save.
     * @return The saved QueuedFile.
     * @throws DataIntegrityViolationException if a duplicate record already exists.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public QueuedFile attemptToCreate(QueuedFile potentialNewFile) throws DataIntegrityViolationException {
        return queuedFileRepository.saveAndFlush(potentialNewFile);
    }
}
