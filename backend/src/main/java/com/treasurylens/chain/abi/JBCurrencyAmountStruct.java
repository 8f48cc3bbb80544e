package com.treasurylens.chain.abi;

import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.generated.Uint224;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;

/**
 * ABI binding for JBCurrencyAmount {uint224 amount; uint32 currency}.
 */
public class JBCurrencyAmountStruct extends StaticStruct {

    public BigInteger amount;
    public BigInteger currency;

    public JBCurrencyAmountStruct(BigInteger amount, BigInteger currency) {
        super(new Uint224(amount), new Uint32(currency));
        this.amount = amount;
        this.currency = currency;
    }

    public JBCurrencyAmountStruct(Uint224 amount, Uint32 currency) {
        super(amount, currency);
        this.amount = amount.getValue();
        this.currency = currency.getValue();
    }
}
