package com.work.bond;

import com.work.bond.core.depository.BondDepository;
import com.work.bond.core.depository.TellerAddressCalculator;
import com.work.bond.core.support.InMemoryAssetLedger;
import com.work.bond.demo.service.BondTellerService;
import com.work.bond.demo.web.dto.TellerView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 按 application.yml 启动完整上下文，检查启动时创建的 teller。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
public class BondDemoApplicationTest {

    @Autowired
    private BondTellerService tellerService;

    @Autowired
    private BondDepository depository;

    @Autowired
    private InMemoryAssetLedger ledger;

    @Test
    public void configured_tellers_are_created_on_startup() {
        List<TellerView> tellers = tellerService.listTellers();

        assertEquals(2, tellers.size());
        TellerView dai = tellers.get(0);
        assertEquals("Solace DAI Bond", dai.getName());
        assertEquals(TellerAddressCalculator.createAddress(depository.getAddress(), 1), dai.getAddress());
        assertEquals("TERMS_UNSET", dai.getState());
        assertEquals(500, dai.getProtocolFeeBps());
        assertTrue(ledger.supportsPermit(dai.getPrincipal()));

        TellerView usdc = tellers.get(1);
        assertEquals(depository.predictTellerAddress(TellerAddressCalculator.toSalt("0x01")), usdc.getAddress());
        assertFalse(usdc.isPermittable());
        assertTrue(ledger.isMinter(depository.getReward(), depository.getAddress()));
    }
}
