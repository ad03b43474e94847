package com.nosota.mvault.repository;

import com.nosota.mvault.model.VaultState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface VaultStateRepository extends JpaRepository<VaultState, Integer> {
    /**
     * Retrieves the {@link VaultState} row and locks it for update.
     * <p>
     * Every operation that changes the vault (proposals, approvals, execution, deposits) calls this first,
     * so the <b>pessimistic write lock</b> serializes those calls: one completes before the next one starts.
     * </p>
     * <p>
     * <b>Note:</b> the lock is held until the surrounding transaction ends. Keep mutating transactions short.
     * </p>
     *
     * @param id Always {@link VaultState#SINGLETON_ID}.
     * @return The locked vault state, or {@code null} if the vault has not been initialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VaultState v WHERE v.id = :id")
    VaultState getOneForUpdate(@Param("id") Integer id);
}
