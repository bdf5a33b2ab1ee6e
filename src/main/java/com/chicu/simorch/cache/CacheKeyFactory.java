package com.chicu.simorch.cache;

import com.chicu.simorch.eval.EvaluationParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ключ кэша = sha-256 (первые 128 бит, hex) от канонического JSON.
 *
 * В идентичность входят: имя операции, threshold, beta, xpm_mode, n2, a_eff, n_eff, g_geom
 * и санитизированные extra-флаги. Флаги упорядочиваются стабильной сортировкой по имени
 * (часть до '='): порядок разных флагов на вывод не влияет, а у повторяющегося флага
 * CLI берёт последнее значение, поэтому их взаимный порядок сохраняется как есть.
 * Отброшенные санитайзером флаги до симулятора не доходят и в ключ не попадают.
 */
@Component
public class CacheKeyFactory {

    private static final int DIGEST_HEX_CHARS = 32;

    // свой mapper: канонический вывод не должен зависеть от настроек приложения
    private final ObjectMapper canonical = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String cascadeKey(EvaluationParams p) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("threshold", p.threshold().wire());
        fields.put("beta", p.beta());
        fields.put("xpm_mode", p.xpmMode().wire());
        fields.put("n2", p.n2());
        fields.put("a_eff", p.aEff());
        fields.put("n_eff", p.nEff());
        fields.put("g_geom", p.gGeom());

        fields.put("extra", canonicalExtra(p.extra()));

        return keyFor("cascade", fields);
    }

    static List<String> canonicalExtra(List<String> extra) {
        List<String> out = new ArrayList<>(extra);
        // List.sort стабилен: одноимённые флаги остаются в исходном порядке
        out.sort(Comparator.comparing(CacheKeyFactory::flagName));
        return out;
    }

    static String flagName(String arg) {
        int eq = arg.indexOf('=');
        return eq < 0 ? arg : arg.substring(0, eq);
    }

    public String keyFor(String operation, Map<String, ?> fields) {
        Map<String, Object> doc = new TreeMap<>(fields);
        doc.put("__op__", operation);
        try {
            return digest(canonical.writeValueAsString(doc));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cache key fields are not serializable: " + e.getMessage(), e);
        }
    }

    private static String digest(String canonicalJson) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(canonicalJson.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
