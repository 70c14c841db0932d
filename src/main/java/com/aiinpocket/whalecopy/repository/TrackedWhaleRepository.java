package com.aiinpocket.whalecopy.repository;

import com.aiinpocket.whalecopy.model.entity.TrackedWhale;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TrackedWhaleRepository extends JpaRepository<TrackedWhale, Long> {

    /** 依地址查詢（地址以小寫儲存） */
    Optional<TrackedWhale> findByAddressIgnoreCase(String address);

    /** 需要定期匯入成交的鯨魚 */
    List<TrackedWhale> findByActiveTrue();
}
