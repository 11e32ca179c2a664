package io.chainindex.core.codec;

import java.util.List;
import java.util.Locale;

/** Registry of supported networks, selected by name at startup. */
public final class Coins {
    private Coins() {}

    public static final CoinSpec BITCOIN_MAINNET = new CoinSpec(
            "BitcoinSegwit", "mainnet",
            "000000000019d6689c085ae165831e934ff763ae46a2a6c172b3f1b60a8ce26f",
            new StaticHeaderFormat(), true, 0x00, 0x05, 200, 8332,
            318_337_769L, 524_213, 1400);

    public static final CoinSpec BITCOIN_TESTNET = new CoinSpec(
            "BitcoinSegwit", "testnet",
            "000000000933ea01ad0ee984209779baaec3ced90fa3f408719526f8d77f4943",
            new StaticHeaderFormat(), true, 0x6f, 0xc4, 8000, 18332,
            12_242_438L, 1_035_428, 21);

    public static final CoinSpec BITCOIN_REGTEST = new CoinSpec(
            "BitcoinSegwit", "regtest",
            "0f9188f13cb7b2c71f2a335e3a4fc328bf5beb436012afca590b1a11466e2206",
            new StaticHeaderFormat(), true, 0x6f, 0xc4, 8000, 18443,
            1L, 1, 1);

    public static final CoinSpec DOGECOIN_MAINNET = new CoinSpec(
            "Dogecoin", "mainnet",
            "1a91e3dace36e2be3bf030a65679fe821aa1d6ef92e7c9902eb318182c355691",
            new AuxPowHeaderFormat(), false, 0x1e, 0x16, 2000, 22555,
            27_583_427L, 1_604_979, 20);

    public static final CoinSpec DOGECOIN_TESTNET = new CoinSpec(
            "Dogecoin", "testnet",
            "bb0a78264637406b6360aad926284d544d7049f45189db5664f3c4d07350559e",
            new AuxPowHeaderFormat(), false, 0x71, 0xc4, 2000, 44555,
            1L, 1, 2);

    private static final List<CoinSpec> ALL = List.of(
            BITCOIN_MAINNET, BITCOIN_TESTNET, BITCOIN_REGTEST, DOGECOIN_MAINNET, DOGECOIN_TESTNET);

    public static List<CoinSpec> all() {
        return ALL;
    }

    /**
     * Finds a coin by name and network, case-insensitively. "Bitcoin" is accepted as an alias
     * for "BitcoinSegwit".
     */
    public static CoinSpec lookup(String name, String net) {
        String wanted = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (wanted.equals("bitcoin") || wanted.equals("btc")) {
            wanted = "bitcoinsegwit";
        }
        String wantedNet = net == null || net.isBlank() ? "mainnet" : net.toLowerCase(Locale.ROOT);
        for (CoinSpec spec : ALL) {
            if (spec.name().toLowerCase(Locale.ROOT).equals(wanted) && spec.net().equals(wantedNet)) {
                return spec;
            }
        }
        throw new IllegalArgumentException("Unknown coin " + name + " on network " + wantedNet);
    }
}
