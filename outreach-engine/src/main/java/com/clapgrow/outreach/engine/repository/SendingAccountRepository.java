package com.clapgrow.outreach.engine.repository;

import com.clapgrow.outreach.engine.entity.SendingAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SendingAccountRepository extends JpaRepository<SendingAccount, Long> {

    Optional<SendingAccount> findByHandle(String handle);
}
