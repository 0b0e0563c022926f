package com.journalengine.bills;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Looks up a user's bills.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillService {

    private final BillRepository billRepository;

    @Transactional
    public Bill createBill(String userId, String name) {
        Bill bill = billRepository.save(new Bill(userId, name));
        log.info("Created bill #{} (\"{}\") for user {}", bill.getId(), name, userId);
        return bill;
    }

    /**
     * Finds a bill by id, then by name. Bills are never created on the fly.
     */
    @Transactional(readOnly = true)
    public Optional<Bill> findBill(String userId, Long billId, String billName) {
        if (billId != null && billId > 0) {
            Optional<Bill> byId = billRepository.findByIdAndUserId(billId, userId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (billName != null && !billName.isBlank()) {
            return billRepository.findFirstByUserIdAndNameOrderByIdAsc(userId, billName.trim());
        }
        return Optional.empty();
    }
}
