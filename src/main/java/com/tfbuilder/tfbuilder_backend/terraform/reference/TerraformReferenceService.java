package com.tfbuilder.tfbuilder_backend.terraform.reference;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/** "Who references what" queries over a set of blocks. */
@Service
@RequiredArgsConstructor
public class TerraformReferenceService {

    private final ReferenceAnalyzer analyzer;

    public List<Block> findReferencesTo(TerraformVariable variable, Collection<Block> blocks) {
        return blocks.stream()
                .filter(block -> block.getProperties().values().stream()
                        .anyMatch(value -> analyzer.findVariableReferences(value).contains(variable.name())))
                .toList();
    }

    /** Other blocks whose properties resolve to this block's (type, formatted name). */
    public List<Block> findReferencesTo(Block block, Collection<Block> allBlocks) {
        ResourceAddress address = addressOf(block);
        return allBlocks.stream()
                .filter(other -> !other.getId().equals(block.getId()))
                .filter(other -> other.getProperties().values().stream()
                        .anyMatch(value -> analyzer.findResourceReferences(value).contains(address)))
                .toList();
    }

    public static ResourceAddress addressOf(Block block) {
        return new ResourceAddress(block.getTypeName(), TerraformNames.formatResourceName(block.getContent()));
    }
}
