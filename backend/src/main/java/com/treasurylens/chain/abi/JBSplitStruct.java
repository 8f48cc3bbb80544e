package com.treasurylens.chain.abi;

import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint48;
import org.web3j.abi.datatypes.generated.Uint64;

import java.math.BigInteger;

/**
 * ABI binding for JBSplit {uint32 percent; uint64 projectId; address beneficiary; bool preferAddToBalance;
 * uint48 lockedUntil; address hook}. Public fields mirror the struct components in order; the decoder relies on it.
 */
public class JBSplitStruct extends StaticStruct {

    public BigInteger percent;
    public BigInteger projectId;
    public String beneficiary;
    public Boolean preferAddToBalance;
    public BigInteger lockedUntil;
    public String hook;

    public JBSplitStruct(BigInteger percent, BigInteger projectId, String beneficiary, Boolean preferAddToBalance,
                         BigInteger lockedUntil, String hook) {
        super(new Uint32(percent), new Uint64(projectId), new Address(beneficiary), new Bool(preferAddToBalance),
                new Uint48(lockedUntil), new Address(hook));
        this.percent = percent;
        this.projectId = projectId;
        this.beneficiary = beneficiary;
        this.preferAddToBalance = preferAddToBalance;
        this.lockedUntil = lockedUntil;
        this.hook = hook;
    }

    public JBSplitStruct(Uint32 percent, Uint64 projectId, Address beneficiary, Bool preferAddToBalance,
                         Uint48 lockedUntil, Address hook) {
        super(percent, projectId, beneficiary, preferAddToBalance, lockedUntil, hook);
        this.percent = percent.getValue();
        this.projectId = projectId.getValue();
        this.beneficiary = beneficiary.getValue();
        this.preferAddToBalance = preferAddToBalance.getValue();
        this.lockedUntil = lockedUntil.getValue();
        this.hook = hook.getValue();
    }
}
